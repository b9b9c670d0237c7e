package com.hartwig.alignpipe.staging;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;

/**
 * Packs a directory output, e.g. a Parquet dataset, into a single tar file so it can be published like any other file.
 * The directory itself is the first member, so extraction yields the directory again.
 */
public final class DirectoryPacker {
    private DirectoryPacker() {
    }

    public static Path pack(Path directory) throws IOException {
        var parent = directory.toAbsolutePath().getParent();
        var archive = parent.resolve(directory.getFileName() + ".tar");
        List<Path> members;
        try (Stream<Path> files = Files.walk(directory)) {
            members = files.sorted().collect(Collectors.toList());
        }
        try (var tar = new TarArchiveOutputStream(Files.newOutputStream(archive))) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            for (Path member : members) {
                var name = parent.relativize(member.toAbsolutePath()).toString();
                var entry = new TarArchiveEntry(member.toFile(), Files.isDirectory(member) ? name + "/" : name);
                tar.putArchiveEntry(entry);
                if (Files.isRegularFile(member)) {
                    Files.copy(member, tar);
                }
                tar.closeArchiveEntry();
            }
            tar.finish();
        }
        return archive;
    }
}
