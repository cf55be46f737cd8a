/* 
 * This source code is subject to the terms of the Creative Commons
 * Attribution-NonCommercial-ShareAlike 4.0 license. If a copy of the BY-NC-SA
 * 4.0 License was not distributed with this file, You can obtain one at
 * https://creativecommons.org/licenses/by-nc-sa/4.0.
*/

package org.cltk.embeddings;

import java.io.IOError;
import java.io.IOException;

import java.util.Arrays;
import java.util.List;

import org.cltk.ConfigurationException;
import org.cltk.Doc;
import org.cltk.Word;

import org.cltk.data.DocImpl;

import org.junit.Test;

import static org.junit.Assert.*;


public class EmbeddingsProcessTest {

    private static Doc doc(String... tokens) {
        return DocImpl.fromTokens(String.join(" ", tokens),
                                  Arrays.asList(tokens));
    }

    private static EmbeddingsProcess process(MapEmbeddings embeddings,
                                             Doc input) {
        EmbeddingsBackends backends = new EmbeddingsBackends(
            MapEmbeddings.factoryOf(embeddings),
            MapEmbeddings.factoryOf(embeddings));
        EmbeddingsProcess p =
            new EmbeddingsProcess(new EmbeddingsConfig("lat"), backends);
        p.setInputDoc(input);
        return p;
    }

    @Test public void testAlgorithmIsResolvedOnceForEverySupportedPair() {
        MapEmbeddings.Factory fastText = new MapEmbeddings.Factory(3);
        MapEmbeddings.Factory nlpl = new MapEmbeddings.Factory(3);
        EmbeddingsBackends backends = new EmbeddingsBackends(fastText, nlpl);

        for (String lang : FastTextEmbeddings.LANGUAGE_TO_FASTTEXT_CODE.keySet()) {
            EmbeddingsProcess p = new EmbeddingsProcess(
                new EmbeddingsConfig(lang, "fasttext", null), backends);
            Embeddings first = p.getAlgorithm();
            assertSame(first, p.getAlgorithm());
        }
        for (String lang : Word2VecEmbeddings.SUPPORTED_LANGUAGES) {
            EmbeddingsProcess p = new EmbeddingsProcess(
                new EmbeddingsConfig(lang, "nlpl", null), backends);
            Embeddings first = p.getAlgorithm();
            assertSame(first, p.getAlgorithm());
        }
        assertEquals(Arrays.asList("ang", "arb", "arc", "got", "lat", "pli", "san"),
                     fastText.languages);
        assertEquals(Word2VecEmbeddings.SUPPORTED_LANGUAGES.size(),
                     nlpl.languages.size());
    }

    @Test public void testAlgorithmIsNotSharedAcrossInstances() {
        MapEmbeddings.Factory factory = new MapEmbeddings.Factory(2);
        EmbeddingsBackends backends = new EmbeddingsBackends(factory, factory);
        EmbeddingsConfig config = new EmbeddingsConfig("got");
        EmbeddingsProcess p1 = new EmbeddingsProcess(config, backends);
        EmbeddingsProcess p2 = new EmbeddingsProcess(config, backends);
        assertNotSame(p1.getAlgorithm(), p2.getAlgorithm());
        assertEquals(2, factory.languages.size());
    }

    @Test public void testAlgorithmIsLazy() {
        MapEmbeddings.Factory factory = new MapEmbeddings.Factory(2);
        EmbeddingsProcess p = new EmbeddingsProcess(
            new EmbeddingsConfig("lat"), new EmbeddingsBackends(factory, factory));
        p.setInputDoc(doc("a"));
        assertFalse(p.isAlgorithmResolved());
        assertTrue(factory.languages.isEmpty());
        p.run();
        assertTrue(p.isAlgorithmResolved());
        p.run();
        assertEquals(1, factory.languages.size());
    }

    @Test public void testVariantSelectsFactory() {
        MapEmbeddings.Factory fastText = new MapEmbeddings.Factory(2);
        MapEmbeddings.Factory nlpl = new MapEmbeddings.Factory(2);
        EmbeddingsProcess p = new EmbeddingsProcess(
            EmbeddingsPreset.GREEK.getConfig(),
            new EmbeddingsBackends(fastText, nlpl));
        p.getAlgorithm();
        assertTrue(fastText.languages.isEmpty());
        assertEquals(Arrays.asList("grc"), nlpl.languages);
    }

    @Test public void testInvalidVariantFailsOnFirstAccess() {
        MapEmbeddings.Factory factory = new MapEmbeddings.Factory(2);
        // Constructing with a bad variant is allowed
        EmbeddingsProcess p = new EmbeddingsProcess(
            new EmbeddingsConfig("lat", "nonexistent", null),
            new EmbeddingsBackends(factory, factory));
        try {
            p.getAlgorithm();
            fail("Expected a ConfigurationException");
        } catch (ConfigurationException ce) {
            assertEquals("nonexistent", ce.getInvalidValue());
            assertEquals(Arrays.asList("fasttext", "nlpl"), ce.getValidOptions());
            assertTrue(ce.getMessage().contains("'fasttext'"));
            assertTrue(ce.getMessage().contains("'nlpl'"));
            assertTrue(ce.getMessage().contains("nonexistent"));
        }
        assertFalse(p.isAlgorithmResolved());
        assertTrue(factory.languages.isEmpty());
    }

    @Test(expected = ConfigurationException.class)
    public void testInvalidVariantFailsRun() {
        EmbeddingsProcess p = new EmbeddingsProcess(
            new EmbeddingsConfig("lat", "glove", null), doc("a"));
        p.run();
    }

    @Test public void testEveryWordGetsVectorInOrder() {
        MapEmbeddings emb = new MapEmbeddings(3)
            .put("arma", 1, 2, 3)
            .put("virumque", 4, 5, 6)
            .put("cano", 7, 8, 9);
        Doc input = doc("arma", "virumque", "cano");
        List<Word> words = input.getWords();
        EmbeddingsProcess p = process(emb, input);
        p.run();

        assertSame(input, p.getOutputDoc());
        assertSame(words, p.getOutputDoc().getWords());
        assertEquals(Arrays.asList("arma", "virumque", "cano"), emb.lookups);
        String[] expected = { "arma", "virumque", "cano" };
        for (int i = 0; i < expected.length; ++i) {
            Word w = words.get(i);
            assertEquals(expected[i], w.getString());
            assertEquals(3, w.getEmbedding().length);
            assertArrayEquals(emb.vectors.get(expected[i]), w.getEmbedding(), 0f);
        }
    }

    @Test public void testExampleWithMissingWord() {
        MapEmbeddings emb = new MapEmbeddings(2).put("a", 1f, 0f);
        EmbeddingsProcess p = process(emb, doc("a", "b"));
        p.run();
        List<Word> words = p.getOutputDoc().getWords();
        assertArrayEquals(new float[] { 1f, 0f }, words.get(0).getEmbedding(), 0f);
        assertArrayEquals(new float[] { 0f, 0f }, words.get(1).getEmbedding(), 0f);
    }

    @Test public void testMissingWordDoesNotAffectOthers() {
        MapEmbeddings emb = new MapEmbeddings(2)
            .put("x", 1f, 2f)
            .put("z", 3f, 4f);
        EmbeddingsProcess p = process(emb, doc("x", "y", "z"));
        p.run();
        List<Word> words = p.getOutputDoc().getWords();
        assertArrayEquals(new float[] { 1f, 2f }, words.get(0).getEmbedding(), 0f);
        assertArrayEquals(new float[] { 0f, 0f }, words.get(1).getEmbedding(), 0f);
        assertArrayEquals(new float[] { 3f, 4f }, words.get(2).getEmbedding(), 0f);
    }

    @Test public void testWrongLengthVectorIsZeroFilled() {
        MapEmbeddings emb = new MapEmbeddings(3)
            .put("short", 1f, 2f)
            .put("ok", 1f, 2f, 3f);
        EmbeddingsProcess p = process(emb, doc("short", "ok"));
        p.run();
        List<Word> words = p.getOutputDoc().getWords();
        assertArrayEquals(new float[3], words.get(0).getEmbedding(), 0f);
        assertArrayEquals(new float[] { 1f, 2f, 3f },
                          words.get(1).getEmbedding(), 0f);
    }

    @Test public void testVectorsAreCopiedFromBackend() {
        MapEmbeddings emb = new MapEmbeddings(2).put("a", 1f, 1f);
        EmbeddingsProcess p = process(emb, doc("a"));
        p.run();
        p.getOutputDoc().getWords().get(0).getEmbedding()[0] = 5f;
        assertArrayEquals(new float[] { 1f, 1f }, emb.vectors.get("a"), 0f);
    }

    @Test public void testRunIsIdempotent() {
        MapEmbeddings emb = new MapEmbeddings(2)
            .put("a", 0.5f, -0.5f);
        Doc input = doc("a", "b", "a");
        EmbeddingsProcess p = process(emb, input);
        p.run();
        float[][] first = new float[3][];
        for (int i = 0; i < 3; ++i)
            first[i] = input.getWords().get(i).getEmbedding();
        p.run();
        for (int i = 0; i < 3; ++i)
            assertArrayEquals(first[i], input.getWords().get(i).getEmbedding(), 0f);
    }

    @Test public void testRunOverwritesPreviousEmbedding() {
        MapEmbeddings emb = new MapEmbeddings(2).put("a", 1f, 2f);
        Doc input = doc("a");
        input.getWords().get(0).setEmbedding(new float[] { 9f, 9f, 9f });
        EmbeddingsProcess p = process(emb, input);
        p.run();
        assertArrayEquals(new float[] { 1f, 2f },
                          input.getWords().get(0).getEmbedding(), 0f);
    }

    @Test public void testEmptyDocDoesNotQueryLength() {
        MapEmbeddings emb = new MapEmbeddings(2);
        Doc input = doc();
        EmbeddingsProcess p = process(emb, input);
        p.run();
        assertSame(input, p.getOutputDoc());
        assertEquals(0, emb.lengthQueries);
    }

    @Test public void testLengthIsQueriedOncePerRun() {
        MapEmbeddings emb = new MapEmbeddings(2);
        EmbeddingsProcess p = process(emb, doc("a", "b", "c"));
        p.run();
        assertEquals(1, emb.lengthQueries);
        p.run();
        assertEquals(2, emb.lengthQueries);
    }

    @Test public void testBackendLookupFailurePropagates() {
        final IllegalStateException failure = new IllegalStateException("boom");
        Embeddings failing = new Embeddings() {
                public float[] getWordVector(String word) {
                    throw failure;
                }
                public int getEmbeddingLength() {
                    return 2;
                }
            };
        EmbeddingsFactory f = MapEmbeddings.factoryOf(failing);
        EmbeddingsProcess p = new EmbeddingsProcess(
            new EmbeddingsConfig("lat"), new EmbeddingsBackends(f, f));
        p.setInputDoc(doc("a"));
        try {
            p.run();
            fail("Expected the backend's exception");
        } catch (IllegalStateException ise) {
            assertSame(failure, ise);
        }
        assertNull(p.getOutputDoc());
    }

    @Test public void testBackendConstructionFailureIsRetried() {
        final int[] calls = { 0 };
        EmbeddingsFactory flaky = new EmbeddingsFactory() {
                public Embeddings newEmbeddings(String language) {
                    if (calls[0]++ == 0)
                        throw new IOError(new IOException("no file"));
                    return new MapEmbeddings(2);
                }
            };
        EmbeddingsProcess p = new EmbeddingsProcess(
            new EmbeddingsConfig("lat"), new EmbeddingsBackends(flaky, flaky));
        try {
            p.getAlgorithm();
            fail("Expected an IOError");
        } catch (IOError expected) { }
        assertFalse(p.isAlgorithmResolved());
        Embeddings e = p.getAlgorithm();
        assertSame(e, p.getAlgorithm());
        assertEquals(2, calls[0]);
    }

    @Test(expected = IllegalStateException.class)
    public void testRunWithoutInput() {
        process(new MapEmbeddings(2), null).run();
    }

    @Test(expected = NullPointerException.class)
    public void testNullConfig() {
        new EmbeddingsProcess(null);
    }
}
