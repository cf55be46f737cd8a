/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.embeddings;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOError;
import java.io.IOException;

import java.nio.charset.StandardCharsets;

import java.util.Arrays;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.google.common.io.Files;

import org.cltk.UnknownLanguageException;

import org.cltk.util.CltkData;
import org.cltk.util.CltkLogger;


/**
 * {@link Embeddings} backed by the fastText vectors Facebook trained on each
 * language's Wikipedia.  The vectors are read from the textual {@code .vec}
 * format: a header line holding the number of words and the number of
 * dimensions, followed by one line per word holding the word and then its
 * values, all separated by spaces.
 */
public class FastTextEmbeddings implements Embeddings {

    /**
     * The languages that have fastText vectors, mapped to the code fastText
     * uses for them.
     */
    public static final Map<String,String> LANGUAGE_TO_FASTTEXT_CODE =
        ImmutableMap.<String,String>builder()
        .put("ang", "ang")
        .put("arb", "ar")
        .put("arc", "arc")
        .put("got", "got")
        .put("lat", "la")
        .put("pli", "pi")
        .put("san", "sa")
        .build();

    /**
     * Creates {@code FastTextEmbeddings} from the data directory.
     */
    public static final EmbeddingsFactory FACTORY = new EmbeddingsFactory() {
            public Embeddings newEmbeddings(String language) {
                return new FastTextEmbeddings(language);
            }
        };

    private final String language;

    private final VectorTable vectors;

    /**
     * Loads the vectors for the language from {@link #getModelFile(String)}.
     */
    public FastTextEmbeddings(String language) {
        this(language, getModelFile(language));
    }

    /**
     * Loads the vectors for the language from the provided file.
     */
    public FastTextEmbeddings(String language, File vectorsFile) {
        checkLanguage(language);
        this.language = language;
        try {
            vectors = loadVectors(vectorsFile);
        } catch (IOException ioe) {
            throw new IOError(ioe);
        }
    }

    /**
     * Returns the file from which the vectors of the language are loaded by
     * default, {@code <data>/<language>/embeddings/fasttext/wiki.<code>.vec}.
     */
    public static File getModelFile(String language) {
        String code = checkLanguage(language);
        return CltkData.getModelFile(language, "embeddings", "fasttext",
                                     "wiki." + code + ".vec");
    }

    private static String checkLanguage(String language) {
        String code = (language == null) ? null
            : LANGUAGE_TO_FASTTEXT_CODE.get(language);
        if (code == null) {
            throw new UnknownLanguageException(
                "fastText", language, LANGUAGE_TO_FASTTEXT_CODE.keySet());
        }
        return code;
    }

    private static VectorTable loadVectors(File vectorsFile) throws IOException {
        CltkLogger.verbose("Loading fastText vectors from %s", vectorsFile);
        BufferedReader br = Files.newReader(vectorsFile, StandardCharsets.UTF_8);
        try {
            String header = br.readLine();
            if (header == null)
                throw new IOException("Empty vectors file: " + vectorsFile);
            String[] counts = header.trim().split("\\s+");
            if (counts.length != 2) {
                throw new IOException(
                    "Expected \"<words> <dimensions>\" header: " + header);
            }
            int numWords = Integer.parseInt(counts[0]);
            int vectorLength = Integer.parseInt(counts[1]);
            VectorTable table = new VectorTable(numWords, vectorLength);

            int lineNo = 1;
            String line = null;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (line.trim().isEmpty())
                    continue;
                String[] parts = line.split(" ");
                // Lines end with a space, which split() drops
                int firstValue = parts.length - vectorLength;
                if (firstValue < 1) {
                    throw new IOException(String.format(
                        "Line %d of %s has fewer than %d values",
                        lineNo, vectorsFile, vectorLength));
                }
                // Words may contain spaces, so everything before the values
                // is the word
                String word = (firstValue == 1) ? parts[0]
                    : String.join(" ", Arrays.asList(parts).subList(0, firstValue));
                float[] vector = new float[vectorLength];
                for (int i = 0; i < vectorLength; ++i)
                    vector[i] = Float.parseFloat(parts[firstValue + i]);
                table.add(word, vector);

                if (numWords >= 10 && (lineNo - 1) % (numWords / 10) == 0) {
                    CltkLogger.veryVerbose("Read %d/%d vectors",
                                           lineNo - 1, numWords);
                }
            }
            CltkLogger.verbose("Loaded %d fastText vectors of length %d",
                               table.size(), vectorLength);
            return table;
        } catch (NumberFormatException nfe) {
            throw new IOException("Malformed number in " + vectorsFile, nfe);
        } finally {
            br.close();
        }
    }

    public String getLanguage() {
        return language;
    }

    /**
     * {@inheritDoc}
     */
    @Override public float[] getWordVector(String word) {
        return vectors.get(word);
    }

    /**
     * {@inheritDoc}
     */
    @Override public int getEmbeddingLength() {
        return vectors.getVectorLength();
    }

    /**
     * Returns the number of words that have vectors.
     */
    public int size() {
        return vectors.size();
    }

    public String toString() {
        return "fastText embeddings for " + language;
    }
}
