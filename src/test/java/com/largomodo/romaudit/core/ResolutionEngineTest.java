package com.largomodo.romaudit.core;

import com.largomodo.romaudit.catalog.InMemoryCatalogStore;
import com.largomodo.romaudit.core.CatalogIntegrityException.IntegrityViolation;
import com.largomodo.romaudit.core.domain.ContentLocation;
import com.largomodo.romaudit.core.domain.EffectiveSet;
import com.largomodo.romaudit.core.domain.ExpectedPart;
import com.largomodo.romaudit.core.domain.ExpectedSample;
import com.largomodo.romaudit.core.domain.IssueKind;
import com.largomodo.romaudit.core.domain.Machine;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Set;

import static com.largomodo.romaudit.RomFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ResolutionEngineTest {

    private ResolutionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new ResolutionEngine(pacmanFamily());
    }

    @Property
    void rootMachinesResolveToTheirOwnParts(@ForAll("partNames") List<String> names,
                                            @ForAll PackagingPolicy policy) {
        InMemoryCatalogStore.Builder builder = InMemoryCatalogStore.builder().machine(machine("root"));
        for (String name : names) {
            builder.part(rom("root", name, bytes(name)));
        }
        builder.machine(cloneOf("child", "root")).part(rom("child", "child.bin", bytes("child")));

        EffectiveSet set = new ResolutionEngine(builder.build()).resolve("root", policy);

        assertEquals(names, set.parts().stream().map(ExpectedPart::name).toList());
        for (ExpectedPart part : set.parts()) {
            assertEquals("root", part.archive());
            assertEquals("root", part.origin());
            assertEquals(checksumOf(bytes(part.name())), part.checksum());
        }
    }

    @Provide
    Arbitrary<List<String>> partNames() {
        return Arbitraries.strings().alpha().numeric().ofMinLength(1).ofMaxLength(12)
                .filter(name -> !name.equals("child.bin"))
                .list().uniqueElements().ofMaxSize(20);
    }

    @ParameterizedTest
    @EnumSource(PackagingPolicy.class)
    void testBiosResolvesToOwnParts(PackagingPolicy policy) {
        EffectiveSet set = engine.resolve("neogeo", policy);

        assertEquals("neogeo", set.archive());
        assertEquals(List.of("sp-s2.sp1"), set.parts().stream().map(ExpectedPart::name).toList());
        assertTrue(set.issues().isEmpty());
    }

    @Test
    void testSplitExpectsMergedPartsInOwnerArchive() {
        EffectiveSet set = engine.resolve("pacman", PackagingPolicy.SPLIT);

        assertEquals("pacman", set.archive());
        ExpectedPart prg1 = set.parts().get(0);
        assertEquals("puckman", prg1.archive(), "Merged rom belongs to the parent archive");
        assertEquals("pm1_prg1.6e", prg1.name(), "Expected under the parent's name");
        assertEquals("pacman", prg1.origin());
        assertEquals("pacman", set.parts().get(1).archive());
        assertEquals("neogeo", set.parts().get(2).archive(),
                "Merge chain through the parent ends at the bios that owns the content");
        assertEquals(1, set.localParts().size());
        assertEquals(2, set.remoteParts().size());
    }

    @Test
    void testNonMergedExpectsEverythingLocally() {
        EffectiveSet set = engine.resolve("pacman", PackagingPolicy.NON_MERGED);

        assertEquals(List.of("pacman.6e", "pacman.6k", "sp-s2.sp1"),
                set.parts().stream().map(ExpectedPart::name).toList());
        assertTrue(set.parts().stream().allMatch(p -> p.archive().equals("pacman")));
        assertEquals(checksumOf(bytes("prg1")), set.parts().get(0).checksum(),
                "Merged part carries the ancestor's checksum");
    }

    @Test
    void testMergedSharesCloneRootArchive() {
        EffectiveSet pacman = engine.resolve("pacman", PackagingPolicy.MERGED);
        EffectiveSet hangly = engine.resolve("hangly", PackagingPolicy.MERGED);

        assertEquals("puckman", pacman.archive());
        assertEquals("pm1_prg1.6e", pacman.parts().get(0).name());
        assertEquals("puckman", pacman.parts().get(0).archive());
        assertEquals("pacman/pacman.6k", pacman.parts().get(1).name(),
                "Colliding clone rom is stored under the clone's folder");
        assertEquals("neogeo", pacman.parts().get(2).archive(), "Bios content stays in the bios archive");
        assertEquals("pacman.6k", hangly.parts().get(1).name(), "First clone by name keeps the plain name");
    }

    @Test
    void testMergedParentStillResolvesToOwnParts() {
        EffectiveSet set = engine.resolve("puckman", PackagingPolicy.MERGED);

        assertEquals(List.of("pm1_prg1.6e", "pm1_prg2.6k", "sp-s2.sp1", "prom.7f"),
                set.parts().stream().map(ExpectedPart::name).toList());
        assertEquals(Set.of("pm1_prg1.6e", "pm1_prg2.6k", "prom.7f", "pacman.6k", "pacman/pacman.6k"),
                engine.familyEntries("puckman"));
    }

    @Test
    void testNoDumpAndOptionalPartsAreNotRequired() {
        EffectiveSet set = engine.resolve("puckman", PackagingPolicy.SPLIT);

        ExpectedPart prom = set.parts().get(3);
        assertTrue(prom.isNoDump());
        assertFalse(prom.required());
        assertTrue(set.parts().get(0).required());
    }

    @Test
    void testDeviceReferencesAddNoParts() {
        EffectiveSet set = engine.resolve("pacman", PackagingPolicy.NON_MERGED);

        assertTrue(set.parts().stream().noneMatch(p -> p.name().equals("z80.bin")));
        assertEquals(List.of("z80.bin"),
                engine.resolve("z80", PackagingPolicy.NON_MERGED).parts().stream().map(ExpectedPart::name).toList());
    }

    @Test
    void testRequiredDevicesAreReferencedDevicesWithParts() {
        assertEquals(List.of("z80"), engine.requiredDevices("pacman"));
        assertEquals(List.of("z80"), engine.resolve("pacman", PackagingPolicy.MERGED).devices());
        assertTrue(engine.requiredDevices("puckman").isEmpty());

        InMemoryCatalogStore store = InMemoryCatalogStore.builder()
                .machine(new Machine("board", null, null, null, false, false, true, null, null, null,
                        List.of("cpu", "speaker", "cpu", "ghost")))
                .part(rom("board", "board.bin", bytes("board")))
                .machine(new Machine("cpu", null, null, null, true, false, false, null, null, null, List.of()))
                .part(rom("cpu", "cpu.bin", bytes("cpu")))
                .machine(new Machine("speaker", null, null, null, true, false, false, null, null, null, List.of()))
                .build();

        assertEquals(List.of("cpu"), new ResolutionEngine(store).requiredDevices("board"),
                "Devices without parts and unknown references need no archive");
    }

    @Test
    void testRequiredDevicesOfUnknownMachine() {
        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> engine.requiredDevices("galaga"));
        assertEquals(IntegrityViolation.UNKNOWN_MACHINE, e.getViolation());
    }

    @Test
    void testSamplesFollowSampleParent() {
        List<ExpectedSample> split = engine.resolve("pacman", PackagingPolicy.SPLIT).samples();
        List<ExpectedSample> merged = engine.resolve("pacman", PackagingPolicy.MERGED).samples();
        List<ExpectedSample> full = engine.resolve("pacman", PackagingPolicy.NON_MERGED).samples();

        assertEquals("puckman", split.get(0).archive(), "credit is declared by the sample parent");
        assertEquals("pacman", split.get(1).archive(), "chomp is pacman's own");
        assertTrue(merged.stream().allMatch(s -> s.archive().equals("puckman")));
        assertTrue(full.stream().allMatch(s -> s.archive().equals("pacman")));
    }

    @Test
    void testCyclicRomofFailsOnlyAffectedMachines() {
        InMemoryCatalogStore store = InMemoryCatalogStore.builder()
                .machine(withBios("a", "b"))
                .part(rom("a", "a.bin", bytes("a")))
                .machine(withBios("b", "a"))
                .part(rom("b", "b.bin", bytes("b")))
                .machine(machine("c"))
                .part(rom("c", "c.bin", bytes("c")))
                .build();
        ResolutionEngine cyclic = new ResolutionEngine(store);

        for (String name : List.of("a", "b")) {
            CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                    () -> cyclic.resolve(name, PackagingPolicy.SPLIT));
            assertEquals(IntegrityViolation.CYCLIC_ANCESTRY, e.getViolation());
            assertEquals(name, e.getMachine());
        }
        assertEquals(1, cyclic.resolve("c", PackagingPolicy.SPLIT).parts().size());
    }

    @Test
    void testSelfReferenceIsCyclic() {
        InMemoryCatalogStore store = InMemoryCatalogStore.builder()
                .machine(cloneOf("loop", "loop"))
                .build();

        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> new ResolutionEngine(store).resolve("loop", PackagingPolicy.NON_MERGED));
        assertEquals(IntegrityViolation.CYCLIC_ANCESTRY, e.getViolation());
    }

    @Test
    void testDanglingMergeIsIntegrityError() {
        InMemoryCatalogStore store = InMemoryCatalogStore.builder()
                .machine(machine("parent"))
                .part(rom("parent", "p.bin", bytes("p")))
                .machine(cloneOf("child", "parent"))
                .part(mergedRom("child", "x.bin", bytes("x"), "nothere.bin"))
                .build();

        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> new ResolutionEngine(store).resolve("child", PackagingPolicy.SPLIT));
        assertEquals(IntegrityViolation.DANGLING_MERGE, e.getViolation());
    }

    @Test
    void testMergeChecksumMismatchIsIntegrityError() {
        InMemoryCatalogStore store = InMemoryCatalogStore.builder()
                .machine(machine("parent"))
                .part(rom("parent", "p.bin", bytes("p")))
                .machine(cloneOf("child", "parent"))
                .part(mergedRom("child", "p.bin", bytes("something else"), "p.bin"))
                .build();

        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> new ResolutionEngine(store).resolve("child", PackagingPolicy.NON_MERGED));
        assertEquals(IntegrityViolation.MERGE_CHECKSUM_MISMATCH, e.getViolation());
    }

    @Test
    void testDuplicatePartNames() {
        InMemoryCatalogStore store = InMemoryCatalogStore.builder()
                .machine(machine("twice"))
                .part(rom("twice", "same.bin", bytes("one")))
                .part(rom("twice", "same.bin", bytes("one")))
                .machine(machine("conflict"))
                .part(rom("conflict", "same.bin", bytes("one")))
                .part(rom("conflict", "same.bin", bytes("two")))
                .build();
        ResolutionEngine resolver = new ResolutionEngine(store);

        assertEquals(1, resolver.resolve("twice", PackagingPolicy.SPLIT).parts().size(),
                "Identical repeated declarations collapse");
        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> resolver.resolve("conflict", PackagingPolicy.SPLIT));
        assertEquals(IntegrityViolation.DUPLICATE_PART_NAME, e.getViolation());
    }

    @Test
    void testMissingAncestorDegradesToLocalPart() {
        InMemoryCatalogStore store = InMemoryCatalogStore.builder()
                .machine(cloneOf("orphan", "ghost"))
                .part(mergedRom("orphan", "g.bin", bytes("g"), "g.bin"))
                .build();

        EffectiveSet set = new ResolutionEngine(store).resolve("orphan", PackagingPolicy.SPLIT);

        assertEquals("orphan", set.parts().get(0).archive(), "Unplaceable merge part is expected locally");
        assertTrue(set.issues().stream().anyMatch(i -> i.kind() == IssueKind.UNRESOLVED_ANCESTOR));
        assertEquals("orphan", new ResolutionEngine(store).archiveOf("orphan", PackagingPolicy.MERGED));
    }

    @Test
    void testUnknownMachine() {
        CatalogIntegrityException e = assertThrows(CatalogIntegrityException.class,
                () -> engine.resolve("galaga", PackagingPolicy.SPLIT));
        assertEquals(IntegrityViolation.UNKNOWN_MACHINE, e.getViolation());
    }

    @Test
    void testLocateSinglePart() {
        assertEquals(new ContentLocation("puckman", "pm1_prg1.6e"),
                engine.locate("pacman", "pacman.6e", PackagingPolicy.SPLIT).orElseThrow());
        assertEquals(new ContentLocation("puckman", "pacman/pacman.6k"),
                engine.locate("pacman", "pacman.6k", PackagingPolicy.MERGED).orElseThrow());
        assertTrue(engine.locate("pacman", "nothere", PackagingPolicy.SPLIT).isEmpty());
    }

    @Test
    void testAncestorQueries() {
        assertEquals(List.of("puckman", "neogeo"), engine.romAncestors("pacman"));
        assertEquals(List.of("puckman"), engine.cloneAncestors("pacman"));
        assertEquals("puckman", engine.cloneRoot("hangly"));
    }

    @Test
    void testRejectsNullStore() {
        assertThrows(IllegalArgumentException.class, () -> new ResolutionEngine(null));
    }
}
