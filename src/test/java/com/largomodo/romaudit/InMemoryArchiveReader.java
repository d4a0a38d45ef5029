package com.largomodo.romaudit;

import com.largomodo.romaudit.archive.ArchiveEntry;
import com.largomodo.romaudit.archive.ArchiveReader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collection held in memory, for tests that do not need real zip files.
 */
public class InMemoryArchiveReader implements ArchiveReader {

    private final Map<String, Map<String, ArchiveEntry>> archives = new ConcurrentHashMap<>();

    public InMemoryArchiveReader put(String archive, String name, byte[] data) {
        return put(RomFixtures.entry(archive, name, data));
    }

    public InMemoryArchiveReader putUnreadable(String archive, String name) {
        return put(RomFixtures.unreadableEntry(archive, name));
    }

    public InMemoryArchiveReader createEmpty(String archive) {
        archives.computeIfAbsent(archive, k -> new TreeMap<>());
        return this;
    }

    private InMemoryArchiveReader put(ArchiveEntry entry) {
        archives.computeIfAbsent(entry.archive(), k -> new TreeMap<>()).put(entry.name(), entry);
        return this;
    }

    @Override
    public List<String> listArchives() {
        return archives.keySet().stream().sorted().toList();
    }

    @Override
    public boolean exists(String archive) {
        return archives.containsKey(archive);
    }

    @Override
    public List<ArchiveEntry> read(String archive) throws IOException {
        Map<String, ArchiveEntry> entries = archives.get(archive);
        if (entries == null) {
            return List.of();
        }
        List<ArchiveEntry> list = new ArrayList<>(entries.values());
        list.sort(Comparator.comparing(ArchiveEntry::name));
        return list;
    }
}
