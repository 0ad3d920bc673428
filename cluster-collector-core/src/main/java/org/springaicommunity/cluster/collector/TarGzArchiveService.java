package org.springaicommunity.cluster.collector;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip-compressed tar implementation of {@link ArchiveService}.
 *
 * <p>
 * Entries are added in sorted path order under a root directory named after the source
 * directory. The archive is streamed to a {@code .part} sibling and moved into place only
 * once complete, so a failed run never leaves a truncated archive under the final name.
 */
public class TarGzArchiveService implements ArchiveService {

	private static final Logger logger = LoggerFactory.getLogger(TarGzArchiveService.class);

	public static final String EXTENSION = ".tar.gz";

	private final TreeWalker treeWalker;

	public TarGzArchiveService() {
		this(root -> Files.walk(root));
	}

	TarGzArchiveService(TreeWalker treeWalker) {
		this.treeWalker = treeWalker;
	}

	@Override
	public String extension() {
		return EXTENSION;
	}

	@Override
	public Path createArchive(Path sourceDirectory, Path archiveFile) {
		Path partFile = archiveFile.resolveSibling(archiveFile.getFileName() + ".part");
		String root = sourceDirectory.getFileName().toString();
		try {
			List<Path> paths;
			try (Stream<Path> walk = treeWalker.walk(sourceDirectory)) {
				paths = walk.sorted().collect(Collectors.toList());
			}
			catch (UncheckedIOException e) {
				throw e.getCause();
			}

			int files = 0;
			try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(partFile));
					GZIPOutputStream gzip = new GZIPOutputStream(out);
					TarArchiveOutputStream tar = new TarArchiveOutputStream(gzip)) {
				tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
				tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
				for (Path path : paths) {
					String entryName = root;
					Path relative = sourceDirectory.relativize(path);
					if (!relative.toString().isEmpty()) {
						entryName = root + "/" + relative.toString().replace('\\', '/');
					}
					TarArchiveEntry entry = tar.createArchiveEntry(path, entryName);
					tar.putArchiveEntry(entry);
					if (Files.isRegularFile(path)) {
						Files.copy(path, tar);
						files++;
					}
					tar.closeArchiveEntry();
				}
				tar.finish();
			}

			moveIntoPlace(partFile, archiveFile);
			logger.info("Created archive {} with {} files", archiveFile, files);
			return archiveFile;
		}
		catch (IOException e) {
			logger.error("Failed to create archive {}", archiveFile, e);
			try {
				Files.deleteIfExists(partFile);
			}
			catch (IOException cleanup) {
				e.addSuppressed(cleanup);
			}
			throw new ArchiveException("Failed to create archive " + archiveFile + ": " + e.getMessage(), e);
		}
	}

	/**
	 * Lists a directory tree, the directory itself included.
	 */
	@FunctionalInterface
	interface TreeWalker {

		Stream<Path> walk(Path root) throws IOException;

	}

	private static void moveIntoPlace(Path partFile, Path archiveFile) throws IOException {
		try {
			Files.move(partFile, archiveFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		}
		catch (AtomicMoveNotSupportedException e) {
			Files.move(partFile, archiveFile, StandardCopyOption.REPLACE_EXISTING);
		}
	}

}
