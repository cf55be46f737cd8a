/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.embeddings;

import java.util.Arrays;
import java.util.List;

import org.cltk.ConfigurationException;
import org.cltk.Doc;
import org.cltk.Process;
import org.cltk.Word;

import org.cltk.util.CltkLogger;


/**
 * A {@link Process} that attaches a word embedding to every word of a
 * document.  The embeddings backend is chosen by the configured language and
 * variant and is only loaded the first time it is needed, after which the
 * same instance is used for the lifetime of this process.
 *
 * <p>Words that the backend has no vector for receive a vector of zeros, so
 * that every word of an annotated document has a vector of the same length.
 *
 * @see EmbeddingsPreset
 */
public class EmbeddingsProcess implements Process {

    private final EmbeddingsConfig config;

    private final EmbeddingsBackends backends;

    /**
     * The resolved backend, or {@code null} until {@link #getAlgorithm()} has
     * succeeded.
     */
    private Embeddings algorithm;

    private Doc inputDoc;

    private Doc outputDoc;

    public EmbeddingsProcess(EmbeddingsConfig config) {
        this(config, EmbeddingsBackends.defaults());
    }

    public EmbeddingsProcess(EmbeddingsConfig config, Doc inputDoc) {
        this(config, EmbeddingsBackends.defaults());
        setInputDoc(inputDoc);
    }

    /**
     * Creates a process whose variants are constructed by the provided
     * backends.
     */
    public EmbeddingsProcess(EmbeddingsConfig config,
                             EmbeddingsBackends backends) {
        if (config == null)
            throw new NullPointerException("config cannot be null");
        if (backends == null)
            throw new NullPointerException("backends cannot be null");
        this.config = config;
        this.backends = backends;
        this.algorithm = null;
    }

    public EmbeddingsConfig getConfig() {
        return config;
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getLanguage() {
        return config.getLanguage();
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getDescription() {
        return config.getDescription();
    }

    /**
     * Returns the embeddings of the configured language and variant,
     * constructing them on the first call.  Every later call returns the same
     * instance.  If construction fails, nothing is cached and the next call
     * tries again.
     *
     * @throws ConfigurationException if the configured variant is not one of
     *         the {@link EmbeddingsVariant#names() supported names}
     */
    public Embeddings getAlgorithm() {
        if (algorithm != null)
            return algorithm;

        EmbeddingsVariant variant =
            EmbeddingsVariant.forName(config.getVariant());
        CltkLogger.verbose("Resolving %s embeddings for %s",
                           variant, config.getLanguage());
        Embeddings resolved =
            backends.forVariant(variant).newEmbeddings(config.getLanguage());
        if (resolved == null) {
            throw new IllegalStateException(
                "The " + variant + " factory returned no embeddings for "
                + config.getLanguage());
        }
        algorithm = resolved;
        return algorithm;
    }

    /**
     * Returns {@code true} once {@link #getAlgorithm()} has constructed the
     * backend.
     */
    public boolean isAlgorithmResolved() {
        return algorithm != null;
    }

    /**
     * {@inheritDoc}
     */
    @Override public void setInputDoc(Doc doc) {
        this.inputDoc = doc;
    }

    /**
     * {@inheritDoc}
     */
    @Override public Doc getInputDoc() {
        return inputDoc;
    }

    /**
     * {@inheritDoc}
     */
    @Override public Doc getOutputDoc() {
        return outputDoc;
    }

    /**
     * Sets the embedding of every word in the input document, in order, and
     * makes the input document the output document.  Any previous embeddings
     * are overwritten.  Exceptions thrown by the backend are not caught.
     */
    @Override public void run() {
        Doc doc = inputDoc;
        if (doc == null)
            throw new IllegalStateException("No input document for " + this);

        Embeddings embeddings = getAlgorithm();
        List<Word> words = doc.getWords();
        int embeddingLength = -1;
        int missing = 0;
        for (Word word : words) {
            if (embeddingLength < 0)
                embeddingLength = embeddings.getEmbeddingLength();

            float[] vector = embeddings.getWordVector(word.getString());
            if (vector == null || vector.length != embeddingLength) {
                CltkLogger.veryVerbose("No %d-dimensional vector for \"%s\"",
                                       embeddingLength, word.getString());
                vector = new float[embeddingLength];
                missing++;
            }
            else
                vector = Arrays.copyOf(vector, vector.length);
            word.setEmbedding(vector);
        }
        outputDoc = doc;
        CltkLogger.verbose("Embedded %d words for %s, %d without a vector",
                           words.size(), config.getLanguage(), missing);
    }

    public String toString() {
        return "EmbeddingsProcess[" + config + "]";
    }
}
