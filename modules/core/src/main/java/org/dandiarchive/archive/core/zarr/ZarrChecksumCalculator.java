package org.dandiarchive.archive.core.zarr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.dandiarchive.archive.core.dao.ZarrFileRecord;
import org.dandiarchive.archive.util.ZarrChecksum;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Tree checksum of a zarr archive's files.
 *
 * <p>Each directory is digested as the MD5 of a compact JSON listing
 * {@code {"directories":[...],"files":[...]}} whose entries are
 * {@code {"digest","name","size"}} sorted by name. A file's digest is its etag; a
 * subdirectory's digest is its own checksum string. The archive checksum is the
 * root directory's.
 */
@ApplicationScoped
public class ZarrChecksumCalculator {

    // Private mapper so output does not depend on application-wide Jackson settings
    private static final ObjectMapper JSON = new ObjectMapper();

    public ZarrChecksum compute(Collection<ZarrFileRecord> files) {
        Directory root = new Directory();
        for (ZarrFileRecord file : files) {
            String[] segments = file.path().split("/");
            Directory dir = root;
            for (int i = 0; i < segments.length - 1; i++) {
                dir = dir.directories.computeIfAbsent(segments[i], k -> new Directory());
            }
            dir.files.put(segments[segments.length - 1], file);
        }
        return digest(root);
    }

    private ZarrChecksum digest(Directory dir) {
        ObjectNode listing = JSON.createObjectNode();
        ArrayNode directories = listing.putArray("directories");
        ArrayNode fileEntries = listing.putArray("files");
        long count = 0;
        long size = 0;

        for (Map.Entry<String, Directory> child : dir.directories.entrySet()) {
            ZarrChecksum sub = digest(child.getValue());
            directories.addObject()
                    .put("digest", sub.toString())
                    .put("name", child.getKey())
                    .put("size", sub.totalSize());
            count += sub.fileCount();
            size += sub.totalSize();
        }
        for (Map.Entry<String, ZarrFileRecord> file : dir.files.entrySet()) {
            fileEntries.addObject()
                    .put("digest", file.getValue().etag())
                    .put("name", file.getKey())
                    .put("size", file.getValue().size());
            count++;
            size += file.getValue().size();
        }
        return new ZarrChecksum(md5Hex(serialize(listing)), count, size);
    }

    private static String serialize(ObjectNode listing) {
        try {
            return JSON.writeValueAsString(listing);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize zarr listing", e);
        }
    }

    private static String md5Hex(String text) {
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static final class Directory {
        final Map<String, Directory> directories = new TreeMap<>();
        final Map<String, ZarrFileRecord> files = new TreeMap<>();
    }
}
