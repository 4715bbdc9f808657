package com.libragraph.pack.formats.gpk;

import com.libragraph.pack.util.buffer.BinaryData;
import org.jboss.logging.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Game file names resolved against a root directory and a set of mounted packages.
 *
 * Names have the form {@code package/path}. A loose file at that path under
 * the root wins. Otherwise the part before the first slash selects a mounted
 * package by base name, ignoring case, and the rest, after
 * {@link #normalizeName(String, String)}, names the entry. Entry lookup
 * ignores case and also tries {@code \} in place of {@code /}.
 *
 * Closing the file system closes every mounted package.
 */
public class PackageFileSystem implements Closeable {

    private static final Logger log = Logger.getLogger(PackageFileSystem.class);

    private final Path root;
    private final PackageLoader loader;
    private final List<PackageArchive> packages = new CopyOnWriteArrayList<>();

    public PackageFileSystem(Path root) {
        this(root, new PackageLoader());
    }

    public PackageFileSystem(Path root, PackageLoader loader) {
        this.root = root.toAbsolutePath().normalize();
        this.loader = loader;
    }

    public Path root() {
        return root;
    }

    /**
     * Loads a package and makes its entries reachable under its base name.
     *
     * @throws PackageLoadException if the package cannot be loaded
     */
    public PackageArchive mount(Path file) {
        PackageArchive archive = loader.load(file);
        packages.add(archive);
        log.infof("Mounted package %s (%d entries)", archive.baseName(), archive.size());
        return archive;
    }

    /** Mounted packages in mount order. */
    public List<PackageArchive> packages() {
        return List.copyOf(packages);
    }

    /** First mounted package whose base name matches, ignoring case. */
    public Optional<PackageArchive> findPackage(String name) {
        for (PackageArchive archive : packages) {
            if (archive.baseName().equalsIgnoreCase(name)) {
                return Optional.of(archive);
            }
        }
        return Optional.empty();
    }

    /**
     * Opens a loose file or a package entry. The caller closes the reader.
     *
     * @throws NoSuchFileException if neither exists
     * @throws java.io.EOFException if the entry lies past the end of its package
     */
    public BinaryData open(String name) throws IOException {
        Optional<Path> loose = looseFile(name);
        if (loose.isPresent()) {
            log.debugf("Opening %s from disk", name);
            return BinaryData.open(loose.get());
        }
        Optional<PackageArchive> archive = packageOf(name);
        if (archive.isPresent()) {
            Optional<PackageEntry> entry = entryOf(archive.get(), name);
            if (entry.isPresent()) {
                return archive.get().open(entry.get());
            }
        }
        throw new NoSuchFileException(name);
    }

    public boolean exists(String name) {
        if (looseFile(name).isPresent()) {
            return true;
        }
        return packageOf(name).flatMap(archive -> entryOf(archive, name)).isPresent();
    }

    /**
     * Lists entry names of one package. The mask is {@code package/pattern}
     * with {@code *} and {@code ?} wildcards in the pattern; an unknown
     * package lists nothing.
     *
     * @throws IllegalArgumentException if the mask has no package part
     */
    public List<String> list(String mask) {
        int slash = mask.indexOf('/');
        if (slash <= 0) {
            throw new IllegalArgumentException("mask must be package/pattern: " + mask);
        }
        return findPackage(mask.substring(0, slash))
                .map(archive -> archive.list(mask.substring(slash + 1)))
                .orElse(List.of());
    }

    /**
     * Applies the per-package naming rules: sound and voice packages store
     * {@code .ogg} files, music packages {@code _loop.ogg} files and event
     * packages {@code .PNG} files, all addressed without the suffix.
     */
    public static String normalizeName(String packageName, String name) {
        String pkg = packageName.toUpperCase(Locale.ROOT);
        if (pkg.startsWith("SYSSE") || pkg.startsWith("SE") || pkg.startsWith("VOICE")) {
            return name + ".ogg";
        }
        if (pkg.startsWith("BGM")) {
            return name + "_loop.ogg";
        }
        if (pkg.startsWith("EVENT")) {
            return name + ".PNG";
        }
        return name;
    }

    private Optional<Path> looseFile(String name) {
        try {
            Path candidate = root.resolve(name.replace('\\', '/')).normalize();
            if (candidate.startsWith(root) && !candidate.equals(root) && Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        } catch (InvalidPathException e) {
            log.debugf("%s is not a valid path under %s", name, root);
        }
        return Optional.empty();
    }

    private Optional<PackageArchive> packageOf(String name) {
        int slash = name.indexOf('/');
        if (slash <= 0) {
            return Optional.empty();
        }
        return findPackage(name.substring(0, slash));
    }

    private static Optional<PackageEntry> entryOf(PackageArchive archive, String name) {
        int slash = name.indexOf('/');
        String path = normalizeName(name.substring(0, slash), name.substring(slash + 1));
        Optional<PackageEntry> entry = archive.find(path);
        if (entry.isEmpty() && path.indexOf('/') >= 0) {
            entry = archive.find(path.replace('/', '\\'));
        }
        return entry;
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (PackageArchive archive : packages) {
            try {
                archive.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        packages.clear();
        if (failure != null) {
            throw failure;
        }
    }
}
