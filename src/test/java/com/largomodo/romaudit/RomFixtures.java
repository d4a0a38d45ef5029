package com.largomodo.romaudit;

import com.largomodo.romaudit.archive.ArchiveEntry;
import com.largomodo.romaudit.catalog.InMemoryCatalogStore;
import com.largomodo.romaudit.core.domain.Checksum;
import com.largomodo.romaudit.core.domain.ContentPart;
import com.largomodo.romaudit.core.domain.DumpStatus;
import com.largomodo.romaudit.core.domain.Machine;
import com.largomodo.romaudit.core.domain.PartType;
import com.largomodo.romaudit.core.domain.Sample;
import com.largomodo.romaudit.hash.Crc32Sha1Function;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds catalog entities and archive entries whose checksums match real bytes.
 */
public final class RomFixtures {

    private static final Crc32Sha1Function HASH = new Crc32Sha1Function();

    private RomFixtures() {
    }

    /**
     * A small arcade family:
     * <ul>
     *   <li>{@code neogeo}: bios with {@code sp-s2.sp1}</li>
     *   <li>{@code puckman}: parent booting from neogeo, one no-dump prom, sample {@code credit}</li>
     *   <li>{@code pacman}: clone merging {@code pm1_prg1.6e} as {@code pacman.6e}, own {@code pacman.6k},
     *       samples {@code credit} and {@code chomp}, device reference to {@code z80}</li>
     *   <li>{@code hangly}: clone whose own {@code pacman.6k} differs from pacman's</li>
     *   <li>{@code z80}: device with its own rom</li>
     * </ul>
     */
    public static InMemoryCatalogStore pacmanFamily() {
        return InMemoryCatalogStore.builder()
                .machine(bios("neogeo"))
                .part(rom("neogeo", "sp-s2.sp1", bytes("bios")))
                .machine(withBios("puckman", "neogeo"))
                .part(rom("puckman", "pm1_prg1.6e", bytes("prg1")))
                .part(rom("puckman", "pm1_prg2.6k", bytes("prg2")))
                .part(mergedRom("puckman", "sp-s2.sp1", bytes("bios"), "sp-s2.sp1"))
                .part(noDump("puckman", "prom.7f"))
                .sample(new Sample("puckman", "credit"))
                .machine(new Machine("pacman", "puckman", "puckman", "puckman", false, false, true,
                        "Pac-Man (Midway)", "1980", "Namco", List.of("z80")))
                .part(mergedRom("pacman", "pacman.6e", bytes("prg1"), "pm1_prg1.6e"))
                .part(rom("pacman", "pacman.6k", bytes("pacman 6k")))
                .part(mergedRom("pacman", "sp-s2.sp1", bytes("bios"), "sp-s2.sp1"))
                .sample(new Sample("pacman", "credit"))
                .sample(new Sample("pacman", "chomp"))
                .machine(cloneOf("hangly", "puckman"))
                .part(mergedRom("hangly", "pm1_prg1.6e", bytes("prg1"), "pm1_prg1.6e"))
                .part(rom("hangly", "pacman.6k", bytes("hangly 6k")))
                .machine(new Machine("z80", null, null, null, true, false, false, null, null, null, List.of()))
                .part(rom("z80", "z80.bin", bytes("z80")))
                .build();
    }

    /**
     * Distinct, deterministic content for a label.
     */
    public static byte[] bytes(String label) {
        return ("rom content of " + label).getBytes(StandardCharsets.UTF_8);
    }

    public static Checksum checksumOf(byte[] data) {
        try {
            return HASH.hash(new ByteArrayInputStream(data)).checksum();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Machine machine(String name) {
        return Machine.of(name);
    }

    /**
     * Clone inheriting roms from its parent: cloneof and romof both set.
     */
    public static Machine cloneOf(String name, String parent) {
        return new Machine(name, parent, parent, null, false, false, true, null, null, null, List.of());
    }

    /**
     * Parent set booting from a bios: romof only.
     */
    public static Machine withBios(String name, String bios) {
        return new Machine(name, null, bios, null, false, false, true, null, null, null, List.of());
    }

    public static Machine bios(String name) {
        return new Machine(name, null, null, null, false, true, false, null, null, null, List.of());
    }

    public static ContentPart rom(String machine, String name, byte[] data) {
        return new ContentPart(machine, name, PartType.ROM, (long) data.length, checksumOf(data),
                DumpStatus.GOOD, null, false, 0);
    }

    public static ContentPart mergedRom(String machine, String name, byte[] data, String merge) {
        return rom(machine, name, data).withMerge(merge);
    }

    public static ContentPart noDump(String machine, String name) {
        return new ContentPart(machine, name, PartType.ROM, 1024L, null, DumpStatus.NODUMP, null, false, 0);
    }

    public static ArchiveEntry entry(String archive, String name, byte[] data) {
        return new ArchiveEntry(archive, name, archive + "!" + name, () -> new ByteArrayInputStream(data));
    }

    /**
     * Writes a zip file with the given entries in map iteration order.
     */
    public static Path writeZip(Path zip, Map<String, byte[]> entries) throws IOException {
        try (ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(zip))) {
            for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
                out.putNextEntry(new ZipEntry(entry.getKey()));
                out.write(entry.getValue());
                out.closeEntry();
            }
        }
        return zip;
    }

    public static ArchiveEntry unreadableEntry(String archive, String name) {
        return new ArchiveEntry(archive, name, archive + "!" + name, () -> {
            throw new IOException("CRC error in " + name);
        });
    }
}
