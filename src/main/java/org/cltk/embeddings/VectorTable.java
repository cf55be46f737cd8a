/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.embeddings;

import java.util.Arrays;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;


/**
 * The word-to-vector storage shared by the file-backed {@link Embeddings}.
 * Vectors are stored as rows of a matrix whose row for a word is found
 * through a primitive index.  Aliases are kept in a second index, so that an
 * alias never hides a word that is stored under the same string.
 */
final class VectorTable {

    private static final int NO_ROW = -1;

    private final int vectorLength;

    private final TObjectIntMap<String> wordToRow;

    private final TObjectIntMap<String> aliasToRow;

    private float[][] rows;

    private int size;

    VectorTable(int expectedWords, int vectorLength) {
        if (vectorLength <= 0) {
            throw new IllegalArgumentException(
                "Vector length must be positive: " + vectorLength);
        }
        int capacity = Math.max(16, expectedWords);
        this.vectorLength = vectorLength;
        this.wordToRow =
            new TObjectIntHashMap<String>(capacity, 0.5f, NO_ROW);
        this.aliasToRow =
            new TObjectIntHashMap<String>(16, 0.5f, NO_ROW);
        this.rows = new float[capacity][];
        this.size = 0;
    }

    /**
     * Adds the vector for the word.  Returns {@code false} without changing
     * the table if the word was already present.
     */
    boolean add(String word, float[] vector) {
        if (vector.length != vectorLength) {
            throw new IllegalArgumentException(String.format(
                "Vector for \"%s\" has %d dimensions; expected %d",
                word, vector.length, vectorLength));
        }
        if (wordToRow.containsKey(word))
            return false;
        if (size == rows.length)
            rows = Arrays.copyOf(rows, rows.length * 2);
        rows[size] = vector;
        wordToRow.put(word, size);
        size++;
        return true;
    }

    /**
     * Makes {@code alias} resolve to the same vector as {@code word}, unless
     * the alias already resolves to another word's vector.  A word stored
     * under the alias itself always takes precedence.
     */
    void alias(String alias, String word) {
        int row = wordToRow.get(word);
        if (row != NO_ROW)
            aliasToRow.putIfAbsent(alias, row);
    }

    float[] get(String word) {
        int row = wordToRow.get(word);
        if (row == NO_ROW)
            row = aliasToRow.get(word);
        return (row == NO_ROW) ? null : rows[row];
    }

    int getVectorLength() {
        return vectorLength;
    }

    /**
     * Returns the number of distinct vectors stored.
     */
    int size() {
        return size;
    }
}
