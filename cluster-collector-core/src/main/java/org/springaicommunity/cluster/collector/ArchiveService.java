package org.springaicommunity.cluster.collector;

import java.nio.file.Path;

/**
 * Service interface for packaging a finished run directory.
 *
 * <p>
 * Abstracts archive creation to enable testability and alternative formats.
 */
public interface ArchiveService {

	/**
	 * File name extension of the archives this service produces, e.g. {@code .tar.gz}.
	 */
	String extension();

	/**
	 * Package a directory tree. The source tree is only read.
	 * @param sourceDirectory the run directory; entries are rooted at its name
	 * @param archiveFile the archive to create
	 * @return the created archive
	 * @throws ArchiveException if the archive cannot be written
	 */
	Path createArchive(Path sourceDirectory, Path archiveFile);

}
