/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.ucdtrie.io.util;

import java.util.Arrays;

import com.google.common.base.Preconditions;

import org.ucdtrie.exceptions.TableFormatException;

/**
 * Base64 codec for arrays of unsigned 16-bit words, stored big endian.
 *
 * The alphabet is the standard {@code A-Z a-z 0-9 + /} with {@code =} padding. A decoded string is made of full
 * groups of 8 characters, each carrying exactly 3 words (6 bytes), optionally followed by one partial group:
 * <ul>
 *   <li>4 characters ({@code xxx=}) carrying one word, the two low bits of the last digit being discarded;</li>
 *   <li>8 characters ({@code xxxxxx==}) carrying two words, the four low bits of the last digit being discarded.</li>
 * </ul>
 * Any other shape is rejected, which makes the accepted language exactly the standard padded base64 of an even
 * number of bytes. Words are carried in {@code char} values, Java's unsigned 16-bit type.
 */
public final class Base64Words
{
    /** Number of characters the table generator puts on each line; a whole number of 3-word groups. */
    public static final int LINE_LENGTH = 64;

    private static final char[] ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789+/".toCharArray();
    private static final byte[] REVERSE = new byte[128];
    private static final byte INVALID = -1;
    private static final char PAD = '=';

    static
    {
        Arrays.fill(REVERSE, INVALID);
        for (int i = 0; i < ALPHABET.length; i++)
            REVERSE[ALPHABET[i]] = (byte) i;
    }

    private Base64Words() {}

    /**
     * Decodes a base64 string into 16-bit words.
     *
     * @throws TableFormatException if the string is empty, not a multiple of 4 in length, contains characters
     * outside the alphabet, or has anything other than padding after the encoded data.
     */
    public static char[] decode(CharSequence s)
    {
        Preconditions.checkNotNull(s);
        int length = s.length();
        if (length < 1 || length % 4 != 0)
            throw new TableFormatException("Base64 length must be a positive multiple of 4, got " + length);

        // the last full group is really a padded partial group if it ends with '='
        int groups = length / 8;
        if (groups > 0 && s.charAt(groups * 8 - 1) == PAD)
        {
            if (length % 8 != 0)
                throw new TableFormatException("Padding inside the base64 data region");
            groups--;
        }

        int base = groups * 8;
        int extra;
        switch (length - base)
        {
            case 0:
                extra = 0;
                break;
            case 4:
                extra = 1;
                break;
            case 8:
                extra = 2;
                break;
            default:
                throw new TableFormatException("Invalid base64 trailing group of " + (length - base) + " characters");
        }

        char[] words = new char[groups * 3 + extra];
        int pos = 0;
        int w = 0;
        for (int g = 0; g < groups; g++)
        {
            long bits = 0;
            for (int j = 0; j < 8; j++)
                bits = (bits << 6) | digit(s, pos++);

            words[w++] = (char) (bits >>> 32);
            words[w++] = (char) (bits >>> 16);
            words[w++] = (char) bits;
        }

        long bits = 0;
        for (int j = 0; j < extra * 3; j++)
            bits = (bits << 6) | digit(s, pos++);

        if (extra == 1)
        {
            words[w] = (char) (bits >>> 2);
        }
        else if (extra == 2)
        {
            bits >>>= 4;
            words[w++] = (char) (bits >>> 16);
            words[w] = (char) bits;
        }

        for (; pos < length; pos++)
        {
            if (s.charAt(pos) != PAD)
                throw new TableFormatException(String.format("Unexpected '%c' at offset %d after base64 data", s.charAt(pos), pos));
        }
        return words;
    }

    /**
     * Encodes 16-bit words as a single padded base64 string. Exact inverse of {@link #decode}.
     */
    public static String encode(char[] words)
    {
        Preconditions.checkArgument(words.length > 0, "Cannot encode an empty word array");
        StringBuilder sb = new StringBuilder((words.length * 8 + 2) / 3 + 4);

        int i = 0;
        for (; i + 3 <= words.length; i += 3)
        {
            long bits = ((long) words[i] << 32) | ((long) words[i + 1] << 16) | words[i + 2];
            for (int shift = 42; shift >= 0; shift -= 6)
                sb.append(ALPHABET[(int) (bits >>> shift) & 0x3F]);
        }

        int remaining = words.length - i;
        if (remaining == 1)
        {
            // 16 bits become 18, the two low bits being zero
            long bits = (long) words[i] << 2;
            for (int shift = 12; shift >= 0; shift -= 6)
                sb.append(ALPHABET[(int) (bits >>> shift) & 0x3F]);
            sb.append(PAD);
        }
        else if (remaining == 2)
        {
            long bits = (((long) words[i] << 16) | words[i + 1]) << 4;
            for (int shift = 30; shift >= 0; shift -= 6)
                sb.append(ALPHABET[(int) (bits >>> shift) & 0x3F]);
            sb.append(PAD).append(PAD);
        }
        return sb.toString();
    }

    /**
     * Encodes the words and splits the result into lines of at most {@link #LINE_LENGTH} characters.
     * Concatenating the lines gives back {@link #encode}'s output.
     */
    public static String[] encodeLines(char[] words)
    {
        String encoded = encode(words);
        String[] lines = new String[(encoded.length() + LINE_LENGTH - 1) / LINE_LENGTH];
        for (int i = 0; i < lines.length; i++)
            lines[i] = encoded.substring(i * LINE_LENGTH, Math.min(encoded.length(), (i + 1) * LINE_LENGTH));
        return lines;
    }

    private static int digit(CharSequence s, int pos)
    {
        char c = s.charAt(pos);
        int v = c < REVERSE.length ? REVERSE[c] : INVALID;
        if (v == INVALID)
            throw new TableFormatException(String.format("Invalid base64 character '%c' at offset %d", c, pos));
        return v;
    }
}
