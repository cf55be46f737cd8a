/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.embeddings;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOError;
import java.io.IOException;

import java.nio.charset.StandardCharsets;

import java.util.Set;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.collect.ImmutableSet;

import org.cltk.UnknownLanguageException;

import org.cltk.util.CltkData;
import org.cltk.util.CltkLogger;


/**
 * {@link Embeddings} backed by the word2vec models of the NLPL word embeddings
 * repository, read from word2vec's binary format.  NLPL vocabularies tag each
 * word with its part of speech ({@code "amor_NOUN"}); lookups of an untagged
 * word fall back to the first tagged form of that word in the model.
 */
public class Word2VecEmbeddings implements Embeddings {

    /**
     * The languages that have NLPL models.
     */
    public static final Set<String> SUPPORTED_LANGUAGES =
        ImmutableSet.of("arb", "chu", "grc", "lat");

    /**
     * Creates {@code Word2VecEmbeddings} from the data directory.
     */
    public static final EmbeddingsFactory FACTORY = new EmbeddingsFactory() {
            public Embeddings newEmbeddings(String language) {
                return new Word2VecEmbeddings(language);
            }
        };

    /**
     * Matches a POS-tagged vocabulary entry, capturing the bare word.
     */
    private static final Pattern TAGGED_WORD =
        Pattern.compile("(.+)_[A-Z]+");

    private final String language;

    private final VectorTable vectors;

    /**
     * Loads the model for the language from {@link #getModelFile(String)}.
     */
    public Word2VecEmbeddings(String language) {
        this(language, getModelFile(language));
    }

    /**
     * Loads the model for the language from the provided file.
     */
    public Word2VecEmbeddings(String language, File modelFile) {
        checkLanguage(language);
        this.language = language;
        try {
            vectors = loadVectors(modelFile);
        } catch (IOException ioe) {
            throw new IOError(ioe);
        }
    }

    /**
     * Returns the file from which the model of the language is loaded by
     * default, {@code <data>/<language>/embeddings/nlpl/model.bin}.
     */
    public static File getModelFile(String language) {
        checkLanguage(language);
        return CltkData.getModelFile(language, "embeddings", "nlpl",
                                     "model.bin");
    }

    private static void checkLanguage(String language) {
        if (language == null || !SUPPORTED_LANGUAGES.contains(language)) {
            throw new UnknownLanguageException(
                "NLPL", language, SUPPORTED_LANGUAGES);
        }
    }

    private static VectorTable loadVectors(File modelFile) throws IOException {
        CltkLogger.verbose("Loading NLPL vectors from %s", modelFile);

        DataInputStream dis = new DataInputStream(
            new BufferedInputStream(new FileInputStream(modelFile)));
        try {
            int numWords = Integer.parseInt(readToken(dis, true).trim());
            int vectorLength = Integer.parseInt(readToken(dis, true).trim());
            VectorTable table = new VectorTable(numWords, vectorLength);

            Matcher m = TAGGED_WORD.matcher("");
            byte[] buf = new byte[4 * vectorLength];
            for (int w = 0; w < numWords; w++) {
                String word = readToken(dis, false);
                dis.readFully(buf);
                float[] vector = new float[vectorLength];
                for (int j = 0; j < vectorLength; j++)
                    vector[j] = getFloat(buf, 4 * j);
                table.add(word, vector);

                m.reset(word);
                if (m.matches())
                    table.alias(m.group(1), word);

                if (numWords >= 10 && w % (numWords / 10) == 0) {
                    CltkLogger.veryVerbose("Read %d/%d vectors",
                                           w, numWords);
                }
            }
            CltkLogger.verbose("Loaded %d NLPL vectors of length %d",
                               table.size(), vectorLength);
            return table;
        } catch (NumberFormatException nfe) {
            throw new IOException("Malformed header in " + modelFile, nfe);
        } finally {
            dis.close();
        }
    }

    /**
     * Reads the little-endian float starting at {@code offset}.
     */
    static float getFloat(byte[] b, int offset) {
        int accum = 0;
        accum = accum | (b[offset] & 0xff) << 0;
        accum = accum | (b[offset + 1] & 0xff) << 8;
        accum = accum | (b[offset + 2] & 0xff) << 16;
        accum = accum | (b[offset + 3] & 0xff) << 24;
        return Float.intBitsToFloat(accum);
    }

    /**
     * Reads the UTF-8 text up to the next space, skipping any newlines that
     * precede it.  If {@code toEndOfLine} is set, a newline also ends the
     * token.
     */
    static String readToken(DataInputStream dis, boolean toEndOfLine)
            throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(64);
        byte b = dis.readByte();
        while (b == '\n')
            b = dis.readByte();
        while (b != ' ' && !(toEndOfLine && b == '\n')) {
            bytes.write(b);
            b = dis.readByte();
        }
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
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
     * Returns the number of vocabulary entries in the model.
     */
    public int size() {
        return vectors.size();
    }

    public String toString() {
        return "NLPL embeddings for " + language;
    }
}
