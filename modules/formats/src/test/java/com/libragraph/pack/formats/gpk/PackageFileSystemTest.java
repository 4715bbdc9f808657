package com.libragraph.pack.formats.gpk;

import com.libragraph.pack.util.buffer.BinaryData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.EOFException;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class PackageFileSystemTest {

    @TempDir
    Path tempDir;

    private Path root;
    private PackageFileSystem fs;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createDirectories(tempDir.resolve("game"));
        Path packs = Files.createDirectories(root.resolve("packs"));

        fs = new PackageFileSystem(root);
        fs.mount(new TestPackageBuilder()
                .add("click.ogg", "click sound")
                .add("cancel.ogg", "cancel sound")
                .writeTo(packs.resolve("se.gpk")));
        fs.mount(new TestPackageBuilder()
                .add("title_loop.ogg", "title music")
                .writeTo(packs.resolve("bgm.gpk")));
        fs.mount(new TestPackageBuilder()
                .add("ev01.PNG", "event image")
                .writeTo(packs.resolve("Event.gpk")));
        fs.mount(new TestPackageBuilder()
                .add("script\\start.txt", "start script")
                .addRange("script\\gone.txt", 1_000_000, 8)
                .writeTo(packs.resolve("data.gpk")));
    }

    @AfterEach
    void tearDown() throws Exception {
        fs.close();
    }

    private String read(String name) throws Exception {
        try (BinaryData data = fs.open(name)) {
            return new String(data.readAll(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void shouldOpenEntriesWithPackageNamingRules() throws Exception {
        assertThat(read("se/click")).isEqualTo("click sound");
        assertThat(read("BGM/title")).isEqualTo("title music");
        assertThat(read("event/EV01")).isEqualTo("event image");
        assertThat(read("data/script\\start.txt")).isEqualTo("start script");
        assertThat(read("data/script/start.txt")).isEqualTo("start script");
    }

    @Test
    void shouldPreferLooseFiles() throws Exception {
        Files.createDirectories(root.resolve("se"));
        Files.writeString(root.resolve("se/click"), "patched click");

        assertThat(read("se/click")).isEqualTo("patched click");
        assertThat(read("se/cancel")).isEqualTo("cancel sound");
    }

    @Test
    void shouldOpenLooseFilesOutsidePackages() throws Exception {
        Files.writeString(root.resolve("config.ini"), "[video]");

        assertThat(read("config.ini")).isEqualTo("[video]");
        assertThat(fs.exists("config.ini")).isTrue();
    }

    @Test
    void shouldReportMissingFiles() throws Exception {
        Files.writeString(tempDir.resolve("outside.txt"), "secret");

        assertThatThrownBy(() -> fs.open("se/missing")).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> fs.open("voice/click")).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> fs.open("noslash")).isInstanceOf(NoSuchFileException.class);
        assertThatThrownBy(() -> fs.open("../outside.txt")).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void shouldCheckExistence() {
        assertThat(fs.exists("se/click")).isTrue();
        assertThat(fs.exists("Se/Cancel")).isTrue();
        assertThat(fs.exists("data/script/gone.txt")).isTrue();
        assertThat(fs.exists("se/click.ogg")).isFalse();
        assertThat(fs.exists("unknown/file")).isFalse();
        assertThat(fs.exists("noslash")).isFalse();
    }

    @Test
    void shouldFailOnEntryPastEndOfPackage() {
        assertThatThrownBy(() -> fs.open("data/script/gone.txt")).isInstanceOf(EOFException.class);
    }

    @Test
    void shouldListOnePackage() {
        assertThat(fs.list("se/*")).containsExactly("click.ogg", "cancel.ogg");
        assertThat(fs.list("SE/c?ncel.*")).containsExactly("cancel.ogg");
        assertThat(fs.list("data/script\\*")).containsExactly("script\\start.txt", "script\\gone.txt");
        assertThat(fs.list("unknown/*")).isEmpty();
        assertThatThrownBy(() -> fs.list("*.ogg")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldTrackMountedPackages() {
        assertThat(fs.packages()).extracting(PackageArchive::baseName)
                .containsExactly("se", "bgm", "Event", "data");
        assertThat(fs.findPackage("EVENT")).isPresent();
        assertThat(fs.findPackage("voice")).isEmpty();
        assertThat(fs.root()).isEqualTo(root.toAbsolutePath().normalize());
    }

    @Test
    void shouldPropagateMountFailures() throws Exception {
        Path bad = Files.write(tempDir.resolve("bad.gpk"), new byte[8]);

        assertThatThrownBy(() -> fs.mount(bad))
                .isInstanceOf(PackageLoadException.class)
                .extracting(e -> ((PackageLoadException) e).reason())
                .isEqualTo(PackageLoadException.Reason.SIGNATURE_INVALID);
        assertThat(fs.packages()).hasSize(4);
    }

    @Test
    void shouldCloseMountedPackages() throws Exception {
        PackageArchive se = fs.findPackage("se").orElseThrow();

        fs.close();

        assertThat(fs.packages()).isEmpty();
        assertThatThrownBy(() -> se.read(se.entries().get(0))).isInstanceOf(ClosedChannelException.class);
    }

    @Test
    void shouldNormalizeNamesPerPackage() {
        assertThat(PackageFileSystem.normalizeName("se", "click")).isEqualTo("click.ogg");
        assertThat(PackageFileSystem.normalizeName("SysSe", "ok")).isEqualTo("ok.ogg");
        assertThat(PackageFileSystem.normalizeName("voice01", "v001")).isEqualTo("v001.ogg");
        assertThat(PackageFileSystem.normalizeName("bgm", "title")).isEqualTo("title_loop.ogg");
        assertThat(PackageFileSystem.normalizeName("event", "ev01")).isEqualTo("ev01.PNG");
        assertThat(PackageFileSystem.normalizeName("data", "script\\start.txt")).isEqualTo("script\\start.txt");
    }
}
