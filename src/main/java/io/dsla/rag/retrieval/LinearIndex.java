package io.dsla.rag.retrieval;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Brute-force {@link IndexBackend} that keeps one array per vector and compares
 * the query against every one of them. It needs no library and is used when the
 * exact backend is not requested or not available.
 */
class LinearIndex implements IndexBackend {

    static final byte[] MAGIC = "DSLALIN1".getBytes(StandardCharsets.US_ASCII);

    private static final Comparator<Neighbor> NEAREST_FIRST = Comparator.comparingDouble(Neighbor::distance)
            .thenComparingInt(Neighbor::position);

    private final int dimension;
    private final List<float[]> vectors = new ArrayList<>();

    LinearIndex(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
    }

    @Override
    public void add(List<float[]> batch) {
        for (int i = 0; i < batch.size(); i++) {
            checkLength(batch.get(i), "vectors[" + i + "]");
        }
        for (float[] vector : batch) {
            vectors.add(vector.clone());
        }
    }

    @Override
    public List<Neighbor> search(float[] query, int k) {
        checkLength(query, "query");
        int limit = Math.min(k, vectors.size());
        if (limit <= 0) {
            return List.of();
        }
        // Worst retained neighbour sits at the head so it can be evicted.
        PriorityQueue<Neighbor> retained = new PriorityQueue<>(limit, NEAREST_FIRST.reversed());
        for (int position = 0; position < vectors.size(); position++) {
            Neighbor candidate = new Neighbor(position, squaredDistance(query, vectors.get(position)));
            if (retained.size() < limit) {
                retained.add(candidate);
            } else if (NEAREST_FIRST.compare(candidate, retained.peek()) < 0) {
                retained.poll();
                retained.add(candidate);
            }
        }
        List<Neighbor> result = new ArrayList<>(retained);
        result.sort(NEAREST_FIRST);
        return result;
    }

    /**
     * Write every vector to a temporary sibling of {@code file} and move it over
     * {@code file} once complete; an existing file is untouched if writing fails.
     */
    @Override
    public void save(Path file) throws IOException {
        Path absolute = file.toAbsolutePath();
        Path temp = Files.createTempFile(absolute.getParent(), absolute.getFileName().toString(), ".tmp");
        try {
            try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(temp)))) {
                out.write(MAGIC);
                out.writeInt(dimension);
                out.writeInt(vectors.size());
                for (float[] vector : vectors) {
                    for (float value : vector) {
                        out.writeFloat(value);
                    }
                }
            }
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException ex) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                ex.addSuppressed(cleanup);
            }
            throw ex;
        }
    }

    /**
     * Read an index written by {@link #save(Path)}. The returned index has the
     * dimension stored in the file.
     */
    static LinearIndex read(Path file) throws IOException {
        try (DataInputStream in = new DataInputStream(new BufferedInputStream(Files.newInputStream(file)))) {
            byte[] magic = new byte[MAGIC.length];
            in.readFully(magic);
            if (!Arrays.equals(magic, MAGIC)) {
                throw new RetrievalConfigurationException("Index file '" + file
                        + "' was not written by the linear backend. Rebuild the index or set "
                        + "rag.retrieval.index-backend to the backend that wrote it");
            }
            int dimension = in.readInt();
            int count = in.readInt();
            if (dimension <= 0 || count < 0) {
                throw new IOException("Index file '" + file + "' has an invalid header: dimension=" + dimension
                        + ", count=" + count);
            }
            LinearIndex index = new LinearIndex(dimension);
            for (int i = 0; i < count; i++) {
                float[] vector = new float[dimension];
                for (int j = 0; j < dimension; j++) {
                    vector[j] = in.readFloat();
                }
                index.vectors.add(vector);
            }
            return index;
        }
    }

    @Override
    public int count() {
        return vectors.size();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public IndexBackendKind kind() {
        return IndexBackendKind.LINEAR;
    }

    private void checkLength(float[] vector, String name) {
        if (vector == null || vector.length != dimension) {
            throw new IllegalArgumentException(name + " must have length " + dimension + " but had "
                    + (vector == null ? "null" : String.valueOf(vector.length)));
        }
    }

    static float squaredDistance(float[] a, float[] b) {
        float sum = 0.0f;
        for (int i = 0; i < a.length; i++) {
            float diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }
}
