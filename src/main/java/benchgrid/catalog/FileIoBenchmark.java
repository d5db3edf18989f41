package benchgrid.catalog;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * num_rw random cycles of: read a 4 KiB page, reverse it, write it back.
 * The scratch file is created (sparse) at file_mb megabytes when missing.
 */
final class FileIoBenchmark implements BenchmarkTask {

    static final int CHUNK_SIZE = 4 * 1024;
    static final int DEFAULT_FILE_MB = 64;

    private final Path file;

    FileIoBenchmark(Path file) {
        this.file = file;
    }

    @Override
    public void run(Map<String, Number> parameters) throws IOException {
        int operations = BenchmarkTask.intParam(parameters, "num_rw");
        Number mb = parameters.get("file_mb");
        long fileSize = (mb == null ? DEFAULT_FILE_MB : Math.max(1, mb.longValue())) * 1024L * 1024L;

        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            if (channel.size() < fileSize) {
                channel.write(ByteBuffer.wrap(new byte[] { 0 }), fileSize - 1);
            }
            long usable = channel.size() - CHUNK_SIZE;
            ByteBuffer buffer = ByteBuffer.allocate(CHUNK_SIZE);
            ThreadLocalRandom rnd = ThreadLocalRandom.current();

            for (int i = 0; i < operations; i++) {
                long offset = usable <= 0 ? 0 : rnd.nextLong(usable + 1);
                buffer.clear();
                channel.read(buffer, offset);
                buffer.flip();
                byte[] data = new byte[buffer.remaining()];
                buffer.get(data);
                reverse(data);
                channel.write(ByteBuffer.wrap(data), offset);
            }
        }
    }

    Path file() {
        return file;
    }

    static Path defaultScratchFile() throws IOException {
        Path path = Files.createTempFile("benchgrid-io-", ".bin");
        path.toFile().deleteOnExit();
        return path;
    }

    private static void reverse(byte[] data) {
        for (int i = 0, j = data.length - 1; i < j; i++, j--) {
            byte tmp = data[i];
            data[i] = data[j];
            data[j] = tmp;
        }
    }
}
