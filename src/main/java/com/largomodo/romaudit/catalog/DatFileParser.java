package com.largomodo.romaudit.catalog;

import com.largomodo.romaudit.core.domain.Checksum;
import com.largomodo.romaudit.core.domain.ContentPart;
import com.largomodo.romaudit.core.domain.DumpStatus;
import com.largomodo.romaudit.core.domain.Machine;
import com.largomodo.romaudit.core.domain.PartType;
import com.largomodo.romaudit.core.domain.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Streaming importer for Logiqx and MAME XML catalogs.
 * <p>
 * Real-world DATs are inconsistent about case ({@code CRC} vs {@code crc}, {@code Machine} vs
 * {@code machine}), so element and attribute names are matched case-insensitively and checksum
 * values are normalized to lower case. A single malformed record (missing name, unparsable
 * checksum) is skipped with a warning; a broken document fails with {@link DatParseException}.
 * <p>
 * Stateless; one instance may parse several files, but not concurrently.
 */
public class DatFileParser {

    private static final Logger logger = LoggerFactory.getLogger(DatFileParser.class);

    private int skippedRecords;

    /**
     * Parse a DAT file from disk.
     *
     * @throws IOException        if the file can not be read
     * @throws DatParseException if the XML structure is broken
     */
    public InMemoryCatalogStore parse(Path datFile) throws IOException {
        if (!Files.isRegularFile(datFile)) {
            throw new IOException("DAT file does not exist: " + datFile);
        }
        logger.info("Loading DAT: {}", datFile);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(datFile))) {
            return parse(in);
        }
    }

    /**
     * Parse a DAT document from a stream. The stream is not closed.
     */
    public InMemoryCatalogStore parse(InputStream in) {
        skippedRecords = 0;
        InMemoryCatalogStore.Builder builder = InMemoryCatalogStore.builder();
        XMLStreamReader reader = null;
        int machineCount = 0;
        try {
            reader = newFactory().createXMLStreamReader(in);
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT) {
                    continue;
                }
                switch (lowerName(reader)) {
                    case "header" -> builder.header(readHeader(reader));
                    case "game", "machine", "software" -> {
                        if (readMachine(reader, builder)) {
                            machineCount++;
                        }
                    }
                    default -> {
                        // datafile / mame roots and unknown wrappers: keep descending
                    }
                }
            }
        } catch (XMLStreamException e) {
            throw new DatParseException("Malformed DAT document: " + e.getMessage(), e);
        } finally {
            closeQuietly(reader);
        }

        logger.info("Parsing complete: {} machines, {} malformed records skipped", machineCount, skippedRecords);
        return builder.build();
    }

    /**
     * Number of records skipped by the last {@link #parse} call.
     */
    public int getSkippedRecords() {
        return skippedRecords;
    }

    private DatHeader readHeader(XMLStreamReader reader) throws XMLStreamException {
        String name = null;
        String description = null;
        String version = null;
        Map<String, String> extra = new LinkedHashMap<>();

        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.END_ELEMENT && lowerName(reader).equals("header")) {
                break;
            }
            if (event != XMLStreamConstants.START_ELEMENT) {
                continue;
            }
            String field = lowerName(reader);
            if (reader.getAttributeCount() > 0 || field.equals("clrmamepro") || field.equals("romcenter")) {
                // Tool hints carry attributes only
                skipElement(reader);
                continue;
            }
            String text = readText(reader);
            switch (field) {
                case "name" -> name = text;
                case "description" -> description = text;
                case "version" -> version = text;
                default -> extra.put(field, text);
            }
        }
        return new DatHeader(name, description, version, extra);
    }

    private boolean readMachine(XMLStreamReader reader, InMemoryCatalogStore.Builder builder)
            throws XMLStreamException {
        String elementName = lowerName(reader);
        Map<String, String> attributes = attributes(reader);
        String name = attributes.get("name");
        if (name == null || name.isBlank()) {
            logger.warn("Skipping {} without name attribute at line {}", elementName,
                    reader.getLocation().getLineNumber());
            skippedRecords++;
            skipElement(reader);
            return false;
        }

        String description = null;
        String year = null;
        String manufacturer = null;
        List<String> deviceRefs = new ArrayList<>();
        List<ContentPart> parts = new ArrayList<>();
        List<Sample> samples = new ArrayList<>();

        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.END_ELEMENT) {
                if (lowerName(reader).equals(elementName)) {
                    break;
                }
                continue;
            }
            if (event != XMLStreamConstants.START_ELEMENT) {
                continue;
            }
            switch (lowerName(reader)) {
                case "description" -> description = readText(reader);
                case "year" -> year = readText(reader);
                case "manufacturer" -> manufacturer = readText(reader);
                case "rom" -> {
                    ContentPart part = readPart(reader, name, PartType.ROM, parts.size());
                    if (part != null) {
                        parts.add(part);
                    }
                    skipElement(reader);
                }
                case "disk" -> {
                    ContentPart part = readPart(reader, name, PartType.DISK, parts.size());
                    if (part != null) {
                        parts.add(part);
                    }
                    skipElement(reader);
                }
                case "sample" -> {
                    String sampleName = attributes(reader).get("name");
                    if (sampleName != null && !sampleName.isBlank()) {
                        samples.add(new Sample(name, sampleName));
                    }
                    skipElement(reader);
                }
                case "device_ref" -> {
                    String device = attributes(reader).get("name");
                    if (device != null && !device.isBlank()) {
                        deviceRefs.add(device);
                    }
                    skipElement(reader);
                }
                default -> skipElement(reader);
            }
        }

        Machine machine = new Machine(
                name,
                attributes.get("cloneof"),
                attributes.get("romof"),
                attributes.get("sampleof"),
                isYes(attributes.get("isdevice")),
                isYes(attributes.get("isbios")),
                !"no".equalsIgnoreCase(attributes.get("runnable")),
                description,
                year,
                manufacturer,
                deviceRefs
        );
        builder.machine(machine);
        parts.forEach(builder::part);
        samples.forEach(builder::sample);
        return true;
    }

    private ContentPart readPart(XMLStreamReader reader, String machine, PartType type, int order) {
        Map<String, String> attributes = attributes(reader);
        String partName = attributes.get("name");
        if (partName == null || partName.isBlank()) {
            logger.warn("Skipping {} without name in machine {}", type, machine);
            skippedRecords++;
            return null;
        }

        DumpStatus status = DumpStatus.fromAttribute(attributes.get("status"));
        Long size = parseSize(attributes.get("size"), machine, partName);
        Checksum checksum = null;
        if (status != DumpStatus.NODUMP) {
            String crc = attributes.get("crc");
            String sha1 = attributes.get("sha1");
            if (crc == null && sha1 == null) {
                logger.debug("{} {} in {} declares no checksum, treating as nodump", type, partName, machine);
                status = DumpStatus.NODUMP;
            } else {
                try {
                    checksum = Checksum.of(crc, sha1);
                } catch (IllegalArgumentException e) {
                    logger.warn("Skipping {} {} in machine {}: {}", type, partName, machine, e.getMessage());
                    skippedRecords++;
                    return null;
                }
            }
        }

        return new ContentPart(machine, partName, type, size, checksum, status,
                attributes.get("merge"), isYes(attributes.get("optional")), order);
    }

    private Long parseSize(String value, String machine, String partName) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            String trimmed = value.trim();
            if (trimmed.startsWith("0x") || trimmed.startsWith("0X")) {
                return Long.parseLong(trimmed.substring(2), 16);
            }
            return Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring unparsable size '{}' of {} in machine {}", value, partName, machine);
            return null;
        }
    }

    private static Map<String, String> attributes(XMLStreamReader reader) {
        Map<String, String> attributes = new HashMap<>();
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            attributes.put(reader.getAttributeLocalName(i).toLowerCase(Locale.ROOT), reader.getAttributeValue(i));
        }
        return attributes;
    }

    private static String readText(XMLStreamReader reader) throws XMLStreamException {
        StringBuilder text = new StringBuilder();
        int depth = 1;
        while (depth > 0 && reader.hasNext()) {
            int event = reader.next();
            switch (event) {
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA,
                        XMLStreamConstants.SPACE -> {
                    if (depth == 1) {
                        text.append(reader.getText());
                    }
                }
                case XMLStreamConstants.START_ELEMENT -> depth++;
                case XMLStreamConstants.END_ELEMENT -> depth--;
                default -> {
                }
            }
        }
        return text.toString().trim();
    }

    /**
     * Moves the reader to the END_ELEMENT matching the current START_ELEMENT.
     */
    private static void skipElement(XMLStreamReader reader) throws XMLStreamException {
        int depth = 1;
        while (depth > 0 && reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                depth++;
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
            }
        }
    }

    private static String lowerName(XMLStreamReader reader) {
        return reader.getLocalName().toLowerCase(Locale.ROOT);
    }

    private static boolean isYes(String value) {
        return "yes".equalsIgnoreCase(value) || "true".equalsIgnoreCase(value);
    }

    private static XMLInputFactory newFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        // DATs reference the Logiqx DTD by URL; never fetch it
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        return factory;
    }

    private static void closeQuietly(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException e) {
            logger.debug("Failed to close XML reader: {}", e.getMessage());
        }
    }
}
