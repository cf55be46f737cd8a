/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.cltk.embeddings.EmbeddingsPreset;

import org.cltk.util.CltkLogger;

import org.cltk.wordnet.WordNetProcess;
import org.cltk.wordnet.WordNets;


/**
 * A sequence of {@link Process}es for one language, where the output of each
 * process is the input of the next.  A pipeline is itself a process, so
 * pipelines may be nested.
 */
public class Pipeline implements Process {

    private final String language;

    private final List<Process> processes;

    private Doc inputDoc;

    private Doc outputDoc;

    public Pipeline(String language) {
        this.language = language;
        this.processes = new ArrayList<Process>();
    }

    public Pipeline(String language, Collection<? extends Process> processes) {
        this(language);
        for (Process p : processes)
            add(p);
    }

    /**
     * Returns the default pipeline for the language: its {@link
     * EmbeddingsPreset embeddings}, if it has any, followed by its {@link
     * WordNetProcess WordNet}, if it has one.
     */
    public static Pipeline forLanguage(String language) {
        Pipeline pipeline = new Pipeline(language);
        EmbeddingsPreset embeddings = EmbeddingsPreset.forLanguage(language);
        if (embeddings != null)
            pipeline.add(embeddings.newProcess());
        if (WordNets.getWordNetCode(language) != null)
            pipeline.add(new WordNetProcess(language));
        return pipeline;
    }

    /**
     * Appends the process to the end of this pipeline.
     *
     * @throws IllegalArgumentException if the process is this pipeline
     */
    public void add(Process p) {
        if (p == null)
            throw new NullPointerException("Cannot add a null process");
        // Avoid recursive adding
        if (p == this)
            throw new IllegalArgumentException("A pipeline cannot contain itself");
        if (language != null && p.getLanguage() != null
                && !language.equals(p.getLanguage())) {
            CltkLogger.warning("Adding %s process to %s pipeline",
                               p.getLanguage(), language);
        }
        processes.add(p);
    }

    /**
     * Returns the processes in the order in which they are run.
     */
    public List<Process> getProcesses() {
        return Collections.unmodifiableList(processes);
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
        StringBuilder sb = new StringBuilder("Pipeline for ").append(language);
        sb.append(':');
        for (Process p : processes)
            sb.append(' ').append(p.getDescription());
        return sb.toString();
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
     * Runs each process in order on the input document.
     */
    @Override public void run() {
        if (inputDoc == null)
            throw new IllegalStateException("No input document for " + this);
        Doc doc = inputDoc;
        for (Process p : processes) {
            CltkLogger.verbose("Running %s", p.getDescription());
            p.setInputDoc(doc);
            p.run();
            doc = p.getOutputDoc();
        }
        outputDoc = doc;
    }

    /**
     * Runs this pipeline on the document and returns the annotated result.
     */
    public Doc run(Doc doc) {
        setInputDoc(doc);
        run();
        return outputDoc;
    }

    public String toString() {
        return "Pipeline[" + language + ", " + processes.size() + " processes]";
    }
}
