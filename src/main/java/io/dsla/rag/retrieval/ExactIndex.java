package io.dsla.rag.retrieval;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.store.ChecksumIndexInput;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.apache.lucene.store.IOContext;
import org.apache.lucene.store.IndexOutput;
import org.apache.lucene.util.IOUtils;
import org.apache.lucene.util.PriorityQueue;
import org.apache.lucene.util.VectorUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exact {@link IndexBackend} built on Apache Lucene: distances come from
 * {@link VectorUtil#squareDistance(float[], float[])}, the k best candidates are
 * kept in a bounded Lucene {@link PriorityQueue}, and the on-disk file uses
 * Lucene's codec header and checksum footer.
 */
class ExactIndex implements IndexBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExactIndex.class);

    static final String CODEC = "DslaExactIndex";
    static final int VERSION = 0;

    private final int dimension;
    private final List<float[]> vectors = new ArrayList<>();

    ExactIndex(int dimension) {
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
        NeighborQueue queue = new NeighborQueue(limit);
        for (int position = 0; position < vectors.size(); position++) {
            queue.insertWithOverflow(new Neighbor(position, VectorUtil.squareDistance(query, vectors.get(position))));
        }
        Neighbor[] nearest = new Neighbor[queue.size()];
        for (int i = nearest.length - 1; i >= 0; i--) {
            nearest[i] = queue.pop();
        }
        return Arrays.asList(nearest);
    }

    @Override
    public void save(Path file) throws IOException {
        Path absolute = file.toAbsolutePath();
        String name = absolute.getFileName().toString();
        try (Directory directory = FSDirectory.open(absolute.getParent())) {
            String tempName = null;
            boolean written = false;
            try (IndexOutput out = directory.createTempOutput(name, "tmp", IOContext.DEFAULT)) {
                tempName = out.getName();
                CodecUtil.writeHeader(out, CODEC, VERSION);
                out.writeInt(dimension);
                out.writeInt(vectors.size());
                for (float[] vector : vectors) {
                    for (float value : vector) {
                        out.writeInt(Float.floatToIntBits(value));
                    }
                }
                CodecUtil.writeFooter(out);
                written = true;
            } finally {
                if (!written && tempName != null) {
                    IOUtils.deleteFilesIgnoringExceptions(directory, tempName);
                }
            }
            directory.sync(List.of(tempName));
            if (Files.exists(absolute)) {
                directory.deleteFile(name);
            }
            directory.rename(tempName, name);
            directory.syncMetaData();
        }
        LOGGER.debug("Wrote {} vectors of dimension {} to {}", vectors.size(), dimension, absolute);
    }

    /**
     * Read an index written by {@link #save(Path)}. The returned index has the
     * dimension stored in the file. A damaged file fails the checksum
     * verification with Lucene's {@code CorruptIndexException}.
     */
    static ExactIndex read(Path file) throws IOException {
        Path absolute = file.toAbsolutePath();
        if (startsWithLinearMagic(absolute)) {
            throw new RetrievalConfigurationException("Index file '" + absolute
                    + "' was written by the linear backend. Rebuild the index or set "
                    + "rag.retrieval.index-backend=linear");
        }
        try (Directory directory = FSDirectory.open(absolute.getParent());
                ChecksumIndexInput in = directory.openChecksumInput(absolute.getFileName().toString(),
                        IOContext.READONCE)) {
            CodecUtil.checkHeader(in, CODEC, VERSION, VERSION);
            int dimension = in.readInt();
            int count = in.readInt();
            if (dimension <= 0 || count < 0) {
                throw new IOException("Index file '" + absolute + "' has an invalid header: dimension=" + dimension
                        + ", count=" + count);
            }
            ExactIndex index = new ExactIndex(dimension);
            for (int i = 0; i < count; i++) {
                float[] vector = new float[dimension];
                for (int j = 0; j < dimension; j++) {
                    vector[j] = Float.intBitsToFloat(in.readInt());
                }
                index.vectors.add(vector);
            }
            CodecUtil.checkFooter(in);
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
        return IndexBackendKind.EXACT;
    }

    private void checkLength(float[] vector, String name) {
        if (vector == null || vector.length != dimension) {
            throw new IllegalArgumentException(name + " must have length " + dimension + " but had "
                    + (vector == null ? "null" : String.valueOf(vector.length)));
        }
    }

    private static boolean startsWithLinearMagic(Path file) throws IOException {
        byte[] head = new byte[LinearIndex.MAGIC.length];
        try (InputStream in = Files.newInputStream(file)) {
            int read = in.readNBytes(head, 0, head.length);
            return read == head.length && Arrays.equals(head, LinearIndex.MAGIC);
        }
    }

    /**
     * Bounded queue whose head is the worst retained neighbour: larger distance,
     * or the later position when distances are equal.
     */
    private static final class NeighborQueue extends PriorityQueue<Neighbor> {

        NeighborQueue(int maxSize) {
            super(maxSize);
        }

        @Override
        protected boolean lessThan(Neighbor a, Neighbor b) {
            if (a.distance() != b.distance()) {
                return a.distance() > b.distance();
            }
            return a.position() > b.position();
        }
    }
}
