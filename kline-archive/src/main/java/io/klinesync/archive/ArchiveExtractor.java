package io.klinesync.archive;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;

/**
 * Copies the CSV member of a downloaded archive to a file. Records are not parsed.
 */
class ArchiveExtractor {

    /**
     * @return bytes of CSV written to {@code target}
     * @throws ArchiveFetchException {@link ErrorKind#TRANSIENT} for a corrupt archive or one without a CSV
     *                               member (a fresh download may fix either), {@link ErrorKind#LOCAL_IO}
     *                               when the disk fails
     */
    long extractCsv(Path zip, Path target) throws ArchiveFetchException {
        InputStream in;
        try {
            in = Files.newInputStream(zip);
        } catch (IOException e) {
            throw ArchiveFetchException.localIo("cannot read " + zip + ": " + e, e);
        }
        try (ZipInputStream zis = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (!entry.isDirectory() && entry.getName().endsWith(".csv")) {
                    return copyEntry(zis, target);
                }
                zis.closeEntry();
            }
        } catch (ZipException | EOFException e) {
            throw ArchiveFetchException.transientFailure("corrupt archive " + zip.getFileName() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw ArchiveFetchException.localIo("cannot read " + zip + ": " + e, e);
        }
        throw ArchiveFetchException.transientFailure("no CSV member in " + zip.getFileName(), null);
    }

    private long copyEntry(ZipInputStream zis, Path target) throws ArchiveFetchException, ZipException {
        long written = 0;
        byte[] buf = new byte[8192];
        try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            while (true) {
                int n;
                try {
                    n = zis.read(buf);
                } catch (ZipException e) {
                    throw e;
                } catch (IOException e) {
                    throw new ZipException("truncated archive: " + e.getMessage());
                }
                if (n < 0) break;
                out.write(buf, 0, n);
                written += n;
            }
        } catch (ZipException e) {
            throw e;
        } catch (IOException e) {
            throw ArchiveFetchException.localIo("cannot write " + target + ": " + e, e);
        }
        if (written == 0) {
            throw ArchiveFetchException.transientFailure("empty CSV member in archive for " + target.getFileName(), null);
        }
        return written;
    }
}
