package io.dsla.rag.retrieval;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic embedding provider that hashes every token into a signed
 * bucket and L2-normalizes the result. It allows the engine to run without an
 * embedding model, but it carries no semantic similarity guarantee: texts are
 * only close when they share tokens. Use it for development and offline work.
 */
class HashedEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(HashedEmbeddingProvider.class);

    private static final Pattern TOKEN = Pattern.compile("[a-zA-Z0-9_]+");

    private static final int DIGEST_BITS = 64;

    private final int dimension;

    HashedEmbeddingProvider(int dimension) {
        if (dimension <= 0) {
            throw new RetrievalConfigurationException(
                    "Hashed embedding dimension must be positive but was " + dimension);
        }
        this.dimension = dimension;
        LOGGER.warn("Using hashed embeddings with {} dimensions. This is a deterministic, non-semantic fallback "
                + "intended for development and testing, not for production retrieval quality.", dimension);
    }

    @Override
    public List<float[]> encode(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    private float[] embed(String text) {
        float[] vector = new float[dimension];
        Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
        boolean anyToken = false;
        while (matcher.find()) {
            anyToken = true;
            byte[] digest = tokenDigest(matcher.group());
            vector[bucket(digest, dimension)] += sign(digest);
        }
        if (!anyToken) {
            return vector;
        }
        double norm = 0.0d;
        for (float value : vector) {
            norm += (double) value * value;
        }
        norm = Math.sqrt(norm);
        if (norm > 0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] = (float) (vector[i] / norm);
            }
        }
        return vector;
    }

    /**
     * BLAKE2b with an eight byte digest over the UTF-8 bytes of the token.
     */
    static byte[] tokenDigest(String token) {
        byte[] input = token.getBytes(StandardCharsets.UTF_8);
        Blake2bDigest blake2b = new Blake2bDigest(DIGEST_BITS);
        blake2b.update(input, 0, input.length);
        byte[] digest = new byte[blake2b.getDigestSize()];
        blake2b.doFinal(digest, 0);
        return digest;
    }

    static int bucket(byte[] digest, int dimension) {
        long unsigned = (digest[0] & 0xFFL)
                | (digest[1] & 0xFFL) << 8
                | (digest[2] & 0xFFL) << 16
                | (digest[3] & 0xFFL) << 24;
        return (int) (unsigned % dimension);
    }

    static float sign(byte[] digest) {
        return (digest[4] & 1) == 0 ? 1.0f : -1.0f;
    }
}
