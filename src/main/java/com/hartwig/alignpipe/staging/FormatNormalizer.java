package com.hartwig.alignpipe.staging;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import htsjdk.samtools.SAMException;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.BlockCompressedInputStream;

/**
 * Turns a staged file into its canonical form. Detection looks at content only, never at the file name: a tar header
 * signature means tar, the gzip magic means gzip unless the content also parses as a BAM, anything else is plain.
 * <p>
 * Tarballs are assumed to carry one logical payload, so the first member stands for the whole archive.
 */
public class FormatNormalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(FormatNormalizer.class);
    public static final int DEFAULT_MAX_PASSES = 4;
    private static final int SIGNATURE_LENGTH = 512;

    public FileFormat detect(Path path) {
        if (Files.isDirectory(path)) {
            return FileFormat.PLAIN;
        }
        var signature = readSignature(path);
        if (TarArchiveInputStream.matches(signature, signature.length)) {
            return FileFormat.TAR;
        }
        if (GzipCompressorInputStream.matches(signature, signature.length)) {
            return isBam(path) ? FileFormat.BAM : FileFormat.GZIP;
        }
        return FileFormat.PLAIN;
    }

    /**
     * One normalization step. Plain files and BAMs are returned unchanged, gzip content is decompressed next to the
     * input and tarballs are extracted into the directory holding them. The compressed input is removed.
     */
    public NormalizedFile normalize(Path path) {
        var format = detect(path);
        switch (format) {
            case GZIP:
                return ImmutableNormalizedFile.of(decompress(path), decompressedName(path.getFileName().toString()), format);
            case TAR:
                var firstMember = extractArchive(path, path.getParent());
                delete(path);
                return NormalizedFile.of(firstMember, format);
            default:
                return NormalizedFile.of(path, format);
        }
    }

    public NormalizedFile normalizeUntilStable(Path path) {
        return normalizeUntilStable(path, DEFAULT_MAX_PASSES);
    }

    /**
     * Repeats {@link #normalize(Path)} until the content is neither compressed nor archived.
     *
     * @throws MalformedStagedFileException if no stable form is reached within the given number of passes
     */
    public NormalizedFile normalizeUntilStable(Path path, int maxPasses) {
        var current = path;
        for (int pass = 0; pass < maxPasses; pass++) {
            var normalized = normalize(current);
            if (normalized.detectedFormat().isStable()) {
                return normalized;
            }
            LOGGER.debug("[{}] Normalized {} content to [{}]", current, normalized.detectedFormat(), normalized.path());
            current = normalized.path();
        }
        throw new MalformedStagedFileException(String.format("Could not normalize '%s' within %d passes, stopped at '%s'",
                path,
                maxPasses,
                current));
    }

    /**
     * Extracts every member of a tar archive, gzip compressed or not, into the given directory.
     *
     * @return path of the first member
     */
    public Path extractArchive(Path archive, Path outputDirectory) {
        var root = outputDirectory.toAbsolutePath().normalize();
        Path firstMember = null;
        try (var input = openMaybeCompressed(archive); var tar = new TarArchiveInputStream(input)) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                var target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root)) {
                    throw new MalformedStagedFileException(String.format("Archive '%s' has member '%s' outside of its directory",
                            archive,
                            entry.getName()));
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    Files.copy(tar, target, StandardCopyOption.REPLACE_EXISTING);
                }
                if (firstMember == null) {
                    firstMember = target;
                }
            }
        } catch (IOException e) {
            throw new MalformedStagedFileException(String.format("Could not extract archive '%s'", archive), e);
        }
        if (firstMember == null) {
            throw new MalformedStagedFileException(String.format("Archive '%s' is empty", archive));
        }
        return firstMember;
    }

    private Path decompress(Path path) {
        var target = path.resolveSibling(decompressedName(path.getFileName().toString()));
        var temporary = path.resolveSibling(path.getFileName() + ".decompressing");
        try (var input = new GzipCompressorInputStream(new BufferedInputStream(Files.newInputStream(path)), true)) {
            Files.copy(input, temporary, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            delete(temporary);
            throw new MalformedStagedFileException(String.format("Could not decompress '%s'", path), e);
        }
        delete(path);
        try {
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new MalformedStagedFileException(String.format("Could not move decompressed '%s' into place", path), e);
        }
        return target;
    }

    static String decompressedName(String name) {
        if (name.endsWith(".tgz")) {
            return name.substring(0, name.length() - ".tgz".length()) + ".tar";
        } else if (name.endsWith(".gz")) {
            return name.substring(0, name.length() - ".gz".length());
        } else if (name.endsWith(".bgz")) {
            return name.substring(0, name.length() - ".bgz".length());
        }
        return name;
    }

    /**
     * BAM files are BGZF compressed and so carry the gzip magic as well. Only content that opens as a BAM counts as one.
     */
    private static boolean isBam(Path path) {
        try (var input = new BufferedInputStream(Files.newInputStream(path))) {
            if (!BlockCompressedInputStream.isValidFile(input)) {
                return false;
            }
        } catch (IOException e) {
            throw new MalformedStagedFileException(String.format("Could not read '%s'", path), e);
        }
        try (var reader = SamReaderFactory.makeDefault().validationStringency(ValidationStringency.SILENT).open(path)) {
            return reader.type() == SamReader.Type.BAM_TYPE;
        } catch (SAMException | IOException e) {
            LOGGER.debug("[{}] BGZF content is not a BAM: {}", path, e.getMessage());
            return false;
        }
    }

    private static InputStream openMaybeCompressed(Path path) throws IOException {
        var input = new BufferedInputStream(Files.newInputStream(path));
        input.mark(SIGNATURE_LENGTH);
        var signature = new byte[SIGNATURE_LENGTH];
        var length = IOUtils.read(input, signature);
        input.reset();
        if (GzipCompressorInputStream.matches(signature, length)) {
            return new GzipCompressorInputStream(input, true);
        }
        return input;
    }

    private static byte[] readSignature(Path path) {
        try (var input = Files.newInputStream(path)) {
            var signature = new byte[SIGNATURE_LENGTH];
            var length = IOUtils.read(input, signature);
            return Arrays.copyOf(signature, length);
        } catch (IOException e) {
            throw new MalformedStagedFileException(String.format("Could not read '%s'", path), e);
        }
    }

    private static void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new MalformedStagedFileException(String.format("Could not remove '%s'", path), e);
        }
    }
}
