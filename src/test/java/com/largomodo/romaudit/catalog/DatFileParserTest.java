package com.largomodo.romaudit.catalog;

import com.largomodo.romaudit.core.domain.ContentPart;
import com.largomodo.romaudit.core.domain.DumpStatus;
import com.largomodo.romaudit.core.domain.Machine;
import com.largomodo.romaudit.core.domain.PartType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatFileParserTest {

    @TempDir
    Path tempDir;

    private DatFileParser parser;
    private InMemoryCatalogStore store;

    @BeforeEach
    void setUp() throws IOException {
        parser = new DatFileParser();
        try (InputStream in = getClass().getResourceAsStream("/dat/arcade.dat")) {
            assertNotNull(in, "Fixture dat/arcade.dat must be on the test classpath");
            store = parser.parse(in);
        }
    }

    @Test
    void testReadsHeader() {
        DatHeader header = store.getHeader();

        assertEquals("Arcade Test Set", header.name());
        assertEquals("0.261", header.version());
        assertEquals("romaudit", header.extra().get("author"));
        assertFalse(header.extra().containsKey("clrmamepro"), "Tool hints are not header fields");
    }

    @Test
    void testReadsMachineRelationsAndFlags() {
        Machine pacman = store.getMachine("pacman").orElseThrow();
        Machine neogeo = store.getMachine("neogeo").orElseThrow();
        Machine z80 = store.getMachine("z80").orElseThrow();

        assertEquals("puckman", pacman.cloneOf());
        assertEquals("puckman", pacman.romOf());
        assertEquals("puckman", pacman.sampleOf());
        assertEquals("Pac-Man (Midway)", pacman.description());
        assertTrue(neogeo.bios());
        assertFalse(neogeo.runnable());
        assertTrue(z80.device(), "machine elements are read like game elements");
        assertEquals(List.of("z80"), store.getMachine("puckman").orElseThrow().deviceRefs());
    }

    @Test
    void testChecksumsAreLowerCased() {
        ContentPart prg1 = store.getPartsOf("puckman").get(0);

        assertEquals("f36e88ab", prg1.checksum().crc32());
        assertEquals("813cecf44bf5464b1aed64b36f5047e4c79ba176", prg1.checksum().sha1());
        assertEquals(2048L, prg1.size());
    }

    @Test
    void testReadsMergeNoDumpAndDisks() {
        List<ContentPart> puckman = store.getPartsOf("puckman");
        List<ContentPart> pacman = store.getPartsOf("pacman");

        assertEquals("sp-s2.sp1", puckman.get(2).merge());
        ContentPart prom = puckman.get(3);
        assertEquals(DumpStatus.NODUMP, prom.status());
        assertTrue(prom.isNoDump(), "nodump parts carry no checksum");

        ContentPart disk = pacman.get(2);
        assertEquals(PartType.DISK, disk.type());
        assertEquals("pacman-hdd.chd", disk.entryName());
        assertNull(disk.checksum().crc32(), "Disks are identified by SHA1 only");
        assertEquals("pm1_prg1.6e", pacman.get(0).merge());
    }

    @Test
    void testReadsSamples() {
        assertEquals("credit", store.getSamplesOf("pacman").get(0).name());
    }

    @Test
    void testSkipsMalformedRecords() {
        assertTrue(store.getMachine("broken").isPresent(), "A machine survives its malformed parts");
        List<ContentPart> parts = store.getPartsOf("broken");

        assertEquals(1, parts.size(), "Nameless rom and unparsable CRC are skipped");
        assertEquals("good.bin", parts.get(0).name());
        assertEquals(16L, parts.get(0).size(), "Hex sizes are accepted");
        assertEquals(3, parser.getSkippedRecords(), "Nameless game, nameless rom and bad CRC");
        assertEquals(5, store.size());
    }

    @Test
    void testMixedCaseElementsAndAttributes() {
        String xml = "<?xml version=\"1.0\"?>\n"
                + "<MAME build=\"0.261\">\n"
                + "  <Machine NAME=\"galaxian\" CloneOf=\"\" ROMOF=\"\">\n"
                + "    <ROM Name=\"galmidw.u\" Size=\"2048\" CRC=\"745E2D61\""
                + " SHA1=\"e65f74e35b1bfaccd407e168ea55678ae9b68edf\"/>\n"
                + "  </Machine>\n"
                + "</MAME>\n";

        InMemoryCatalogStore parsed = parser.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));

        Machine galaxian = parsed.getMachine("galaxian").orElseThrow();
        assertNull(galaxian.cloneOf(), "Empty relation attributes mean no relation");
        assertEquals("745e2d61", parsed.getPartsOf("galaxian").get(0).checksum().crc32());
    }

    @Test
    void testBrokenDocumentFails() {
        String xml = "<datafile><game name=\"x\"><rom name=\"a\" crc=\"00000000\"></datafile>";

        assertThrows(DatParseException.class,
                () -> parser.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> parser.parse(tempDir.resolve("missing.dat")));
    }

    @Test
    void testParsesFromPath() throws IOException {
        Path dat = tempDir.resolve("tiny.dat");
        Files.writeString(dat, "<datafile><game name=\"tiny\"><rom name=\"t.bin\" size=\"1\" crc=\"0\"/></game></datafile>");

        InMemoryCatalogStore parsed = parser.parse(dat);

        assertEquals("00000000", parsed.getPartsOf("tiny").get(0).checksum().crc32());
    }
}
