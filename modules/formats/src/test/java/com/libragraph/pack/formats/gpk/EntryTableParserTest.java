package com.libragraph.pack.formats.gpk;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

class EntryTableParserTest {

    private final EntryTableParser parser = new EntryTableParser();

    @Test
    void shouldParseEntriesInOrder() {
        byte[] table = new TestPackageBuilder()
                .add("A.OGG", new byte[10])
                .add("B.PNG", new byte[20])
                .table();

        EntryTable result = parser.parse(table);

        assertThat(result.termination()).isEqualTo(EntryTable.Termination.END_MARKER);
        assertThat(result.entries()).extracting(PackageEntry::name).containsExactly("A.OGG", "B.PNG");
        assertThat(result.entries().get(0).offset()).isZero();
        assertThat(result.entries().get(0).compressedLength()).isEqualTo(10);
        assertThat(result.entries().get(1).offset()).isEqualTo(10);
        assertThat(result.entries().get(1).compressedLength()).isEqualTo(20);
    }

    @Test
    void shouldDecodeRecordFields() {
        EntryRecord record = new EntryRecord(3, 7, 0, 0x11223344L, 0x00ABCDEFL, "DFLT", 4096, 0);
        ByteArrayOutputStream table = new ByteArrayOutputStream();
        table.writeBytes(TestPackageBuilder.nameField("data\\x.bin"));
        table.writeBytes(record.toBytes());
        table.writeBytes(new byte[2]);

        EntryTable result = parser.parse(table.toByteArray());

        assertThat(result.entries()).hasSize(1);
        PackageEntry entry = result.entries().get(0);
        assertThat(entry.name()).isEqualTo("data\\x.bin");
        assertThat(entry.record()).isEqualTo(record);
        assertThat(entry.isCompressed()).isTrue();
        assertThat(entry.end()).isEqualTo(0x11223344L + 0x00ABCDEFL);
        assertThat(entry.extension()).isEqualTo("bin");
    }

    @Test
    void shouldDecodeNonAsciiNames() {
        byte[] table = new TestPackageBuilder().add("voice/ボイス.ogg", new byte[1]).table();

        assertThat(parser.parse(table).entries()).extracting(PackageEntry::name)
                .containsExactly("voice/ボイス.ogg");
    }

    @Test
    void shouldSkipSubHeader() {
        EntryRecord first = new EntryRecord(1, 1, 0, 0, 5, "    ", 0, 3);
        EntryRecord second = new EntryRecord(1, 1, 0, 5, 5, "    ", 0, 0);
        ByteArrayOutputStream table = new ByteArrayOutputStream();
        table.writeBytes(TestPackageBuilder.nameField("a\\one.txt"));
        table.writeBytes(first.toBytes());
        table.writeBytes(new byte[]{9, 9, 9});
        table.writeBytes(TestPackageBuilder.nameField("a\\two.txt"));
        table.writeBytes(second.toBytes());

        EntryTable result = parser.parse(table.toByteArray());

        assertThat(result.entries()).extracting(PackageEntry::name).containsExactly("a\\one.txt", "a\\two.txt");
        assertThat(result.termination()).isEqualTo(EntryTable.Termination.END_OF_DATA);
    }

    @Test
    void shouldBeIdempotent() {
        byte[] table = new TestPackageBuilder()
                .add("bgm\\title.ogg", new byte[100])
                .add("cg\\ev01.png", new byte[50])
                .add("script\\start.txt", new byte[7])
                .table();

        EntryTable first = parser.parse(table);
        EntryTable second = parser.parse(Arrays.copyOf(table, table.length));

        assertThat(second).isEqualTo(first);
        assertThat(second.entries()).containsExactlyElementsOf(first.entries());
    }

    @Test
    void shouldStopAtGarbageAfterValidEntries() {
        byte[] garbage = new byte[48];
        Arrays.fill(garbage, (byte) 0xFF);
        byte[] table = new TestPackageBuilder()
                .add("se\\click.ogg", new byte[4])
                .add("se\\cancel.ogg", new byte[4])
                .add("se\\open.ogg", new byte[4])
                .unterminated()
                .tableSuffix(garbage)
                .table();

        EntryTable result = parser.parse(table);

        assertThat(result.entries()).hasSize(3);
        assertThat(result.termination()).isEqualTo(EntryTable.Termination.RESYNC_FAILED);
        assertThat(result.terminatedCleanly()).isFalse();
    }

    @Test
    void shouldResyncPastJunkToNextEntry() {
        EntryRecord record = new EntryRecord(1, 1, 0, 0, 1, "    ", 0, 0);
        ByteArrayOutputStream table = new ByteArrayOutputStream();
        table.writeBytes(TestPackageBuilder.nameField("bgm\\a.ogg"));
        table.writeBytes(record.toBytes());
        table.writeBytes(new byte[]{(byte) 0xFF, (byte) 0xFF, 0x13});
        table.writeBytes(TestPackageBuilder.nameField("bgm\\b.ogg"));
        table.writeBytes(record.toBytes());
        table.writeBytes(new byte[2]);

        EntryTable result = parser.parse(table.toByteArray());

        assertThat(result.entries()).extracting(PackageEntry::name).containsExactly("bgm\\a.ogg", "bgm\\b.ogg");
        assertThat(result.termination()).isEqualTo(EntryTable.Termination.END_MARKER);
    }

    @Test
    void shouldResyncPastStrayZeroWord() {
        EntryRecord record = new EntryRecord(1, 1, 0, 0, 0, "    ", 0, 0);
        ByteArrayOutputStream table = new ByteArrayOutputStream();
        table.writeBytes(TestPackageBuilder.nameField("a\\one.txt"));
        table.writeBytes(record.toBytes());
        table.writeBytes(new byte[2]);
        table.writeBytes(TestPackageBuilder.nameField("a\\two.txt"));
        table.writeBytes(record.toBytes());

        EntryTable result = parser.parse(table.toByteArray());

        assertThat(result.entries()).extracting(PackageEntry::name).containsExactly("a\\one.txt", "a\\two.txt");
        assertThat(result.termination()).isEqualTo(EntryTable.Termination.END_OF_DATA);
    }

    @Test
    void shouldEndAtZeroWordWithoutEntryAfterIt() {
        EntryRecord record = new EntryRecord(1, 1, 0, 0, 0, "    ", 0, 0);
        ByteArrayOutputStream table = new ByteArrayOutputStream();
        table.writeBytes(TestPackageBuilder.nameField("a\\one.txt"));
        table.writeBytes(record.toBytes());
        table.writeBytes(new byte[2]);
        table.writeBytes(TestPackageBuilder.nameField("plainname"));
        table.writeBytes(record.toBytes());

        EntryTable result = parser.parse(table.toByteArray());

        assertThat(result.entries()).extracting(PackageEntry::name).containsExactly("a\\one.txt");
        assertThat(result.termination()).isEqualTo(EntryTable.Termination.END_MARKER);
        assertThat(result.terminatedCleanly()).isTrue();
    }

    @Test
    void shouldNotResyncOntoNamesWithoutPathAndExtension() {
        EntryRecord record = new EntryRecord(1, 1, 0, 0, 1, "    ", 0, 0);
        ByteArrayOutputStream table = new ByteArrayOutputStream();
        table.writeBytes(TestPackageBuilder.nameField("bgm\\a.ogg"));
        table.writeBytes(record.toBytes());
        table.writeBytes(new byte[]{(byte) 0xFF, (byte) 0xFF});
        table.writeBytes(TestPackageBuilder.nameField("README"));
        table.writeBytes(record.toBytes());

        EntryTable result = parser.parse(table.toByteArray());

        assertThat(result.entries()).extracting(PackageEntry::name).containsExactly("bgm\\a.ogg");
        assertThat(result.termination()).isEqualTo(EntryTable.Termination.RESYNC_FAILED);
    }

    @Test
    void shouldReportTruncatedTable() {
        byte[] table = new TestPackageBuilder()
                .add("a\\one.txt", new byte[1])
                .add("a\\two.txt", new byte[1])
                .unterminated()
                .table();

        EntryTable result = parser.parse(Arrays.copyOf(table, table.length - 5));

        assertThat(result.entries()).extracting(PackageEntry::name).containsExactly("a\\one.txt");
        assertThat(result.termination()).isEqualTo(EntryTable.Termination.TRUNCATED);
    }

    @Test
    void shouldTreatEmptyTableAsClean() {
        assertThat(parser.parse(new byte[0]).termination()).isEqualTo(EntryTable.Termination.END_OF_DATA);
        assertThat(parser.parse(new byte[2]).termination()).isEqualTo(EntryTable.Termination.END_MARKER);
        assertThat(parser.parse(new byte[2]).entries()).isEmpty();
    }

    @Test
    void shouldReportGarbageOnlyTable() {
        byte[] garbage = new byte[64];
        Arrays.fill(garbage, (byte) 0xEE);

        EntryTable result = parser.parse(garbage);

        assertThat(result.entries()).isEmpty();
        assertThat(result.termination()).isEqualTo(EntryTable.Termination.RESYNC_FAILED);
    }

    @Test
    void shouldRejectNonPositiveWindow() {
        assertThatThrownBy(() -> new EntryTableParser(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
