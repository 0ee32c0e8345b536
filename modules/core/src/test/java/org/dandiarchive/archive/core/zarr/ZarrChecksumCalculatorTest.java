package org.dandiarchive.archive.core.zarr;

import org.dandiarchive.archive.core.dao.ZarrFileRecord;
import org.dandiarchive.archive.core.testing.TestArchive;
import org.dandiarchive.archive.util.ZarrChecksum;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ZarrChecksumCalculatorTest {

    private static final String E1 = "0123456789abcdef0123456789abcdef";
    private static final String E2 = "fedcba9876543210fedcba9876543210";

    private final ZarrChecksumCalculator calculator = new ZarrChecksumCalculator();

    @Test
    void flatListingDigestsTheCompactJson() {
        ZarrChecksum checksum = calculator.compute(List.of(file(".zattrs", E1, 7)));

        String listing = "{\"directories\":[],\"files\":[{\"digest\":\"" + E1 + "\",\"name\":\".zattrs\",\"size\":7}]}";
        assertThat(checksum.md5()).isEqualTo(TestArchive.md5Hex(listing.getBytes(StandardCharsets.UTF_8)));
        assertThat(checksum.fileCount()).isEqualTo(1);
        assertThat(checksum.totalSize()).isEqualTo(7);
    }

    @Test
    void subdirectoryEntryCarriesItsOwnChecksum() {
        ZarrChecksum sub = calculator.compute(List.of(file("c", E2, 5)));
        ZarrChecksum nested = calculator.compute(List.of(file("0/c", E2, 5)));

        String listing = "{\"directories\":[{\"digest\":\"" + sub + "\",\"name\":\"0\",\"size\":5}],\"files\":[]}";
        assertThat(nested.md5()).isEqualTo(TestArchive.md5Hex(listing.getBytes(StandardCharsets.UTF_8)));
        assertThat(nested.toString()).endsWith("-1--5");
    }

    @Test
    void independentOfInputOrder() {
        List<ZarrFileRecord> files = List.of(file("0/0", E1, 10), file("0/1", E2, 20), file(".zarray", E1, 3));

        assertThat(calculator.compute(files))
                .isEqualTo(calculator.compute(List.of(files.get(2), files.get(1), files.get(0))));
    }

    @Test
    void contentChangeChangesTheChecksum() {
        ZarrChecksum before = calculator.compute(List.of(file("0/0", E1, 10)));
        ZarrChecksum after = calculator.compute(List.of(file("0/0", E2, 10)));

        assertThat(after.md5()).isNotEqualTo(before.md5());
        assertThat(after.totalSize()).isEqualTo(before.totalSize());
    }

    @Test
    void emptyArchiveHasZeroTotals() {
        ZarrChecksum empty = calculator.compute(List.of());

        assertThat(empty.fileCount()).isZero();
        assertThat(empty.totalSize()).isZero();
    }

    private static ZarrFileRecord file(String path, String etag, long size) {
        return new ZarrFileRecord(0, 0, path, etag, size);
    }
}
