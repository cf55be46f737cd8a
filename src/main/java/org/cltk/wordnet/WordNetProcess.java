/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.wordnet;

import edu.mit.jwi.IDictionary;

import org.cltk.Doc;
import org.cltk.Process;

import org.cltk.util.CltkLogger;


/**
 * A {@link Process} that gives the words of a document access to the WordNet
 * of its language.  Languages without a WordNet are not an error; the process
 * simply has no dictionary and leaves documents unchanged.
 *
 * <p>Attaching senses to words is not implemented.  Subclasses may do so by
 * overriding {@link #attachSenses(Doc, IDictionary)}.
 */
public class WordNetProcess implements Process {

    private final String language;

    private final WordNetReaderFactory readers;

    /**
     * The resolved dictionary, which stays {@code null} after resolution for
     * languages without a WordNet.
     */
    private IDictionary algorithm;

    private boolean resolved;

    private Doc inputDoc;

    private Doc outputDoc;

    public WordNetProcess(String language) {
        this(language, WordNets.FACTORY);
    }

    public WordNetProcess(String language, WordNetReaderFactory readers) {
        if (readers == null)
            throw new NullPointerException("readers cannot be null");
        this.language = language;
        this.readers = readers;
        this.algorithm = null;
        this.resolved = false;
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getLanguage() {
        return language;
    }

    /**
     * {@inheritDoc}
     */
    @Override public String getDescription() {
        return "WordNet for " + language + ".";
    }

    /**
     * Returns the WordNet of the configured language, opening it on the first
     * call, or {@code null} if the language has no WordNet.  Every later call
     * returns the same result.
     */
    public IDictionary getAlgorithm() {
        if (resolved)
            return algorithm;

        String code = WordNets.getWordNetCode(language);
        if (code == null) {
            CltkLogger.verbose("No WordNet for %s", language);
            algorithm = null;
        }
        else
            algorithm = readers.newReader(code);
        resolved = true;
        return algorithm;
    }

    /**
     * Returns {@code true} once {@link #getAlgorithm()} has been resolved,
     * even if it resolved to no dictionary.
     */
    public boolean isAlgorithmResolved() {
        return resolved;
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
     * Makes the input document the output document and, if the language has
     * a WordNet, passes both to {@link #attachSenses(Doc, IDictionary)}.
     */
    @Override public void run() {
        Doc doc = inputDoc;
        if (doc == null)
            throw new IllegalStateException("No input document for " + this);

        IDictionary dict = getAlgorithm();
        outputDoc = doc;
        if (dict != null)
            attachSenses(doc, dict);
    }

    /**
     * Annotates the words of the document with their senses in the
     * dictionary.  This implementation does nothing.
     *
     * <p>An implementation would look up each {@link org.cltk.Word#getLemma()
     * lemma} and store the synsets found under {@link
     * org.cltk.CltkAnnotations.Senses}.
     */
    protected void attachSenses(Doc doc, IDictionary dict) {
    }

    public String toString() {
        return "WordNetProcess[" + language + "]";
    }
}
