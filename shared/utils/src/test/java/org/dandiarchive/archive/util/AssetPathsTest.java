package org.dandiarchive.archive.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class AssetPathsTest {

    @ParameterizedTest
    @ValueSource(strings = {"a.nwb", "sub-01/a.nwb", "sub-01/ses 1/array.zarr", "deep/er/still/file.txt"})
    void acceptsSafePaths(String path) {
        assertThat(AssetPaths.isValid(path)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "/abs.nwb", "trailing/", "double//slash", "./a", "a/../b", "a/.", "tab\there", "nul\u0000"})
    void rejectsUnsafePaths(String path) {
        assertThat(AssetPaths.isValid(path)).isFalse();
    }

    @Test
    void rejectsNull() {
        assertThat(AssetPaths.isValid(null)).isFalse();
        assertThat(AssetPaths.isDirectoryPrefix(null)).isFalse();
    }

    @Test
    void directoryPrefixMustBeRootOrEndWithSeparator() {
        assertThat(AssetPaths.isDirectoryPrefix("")).isTrue();
        assertThat(AssetPaths.isDirectoryPrefix("sub/")).isTrue();
        assertThat(AssetPaths.isDirectoryPrefix("sub/deep/")).isTrue();
        assertThat(AssetPaths.isDirectoryPrefix("sub")).isFalse();
        assertThat(AssetPaths.isDirectoryPrefix("/")).isFalse();
        assertThat(AssetPaths.isDirectoryPrefix("sub//")).isFalse();
    }

    @Test
    void ancestorsAreOutermostFirst() {
        assertThat(AssetPaths.ancestors("a/b/c.nwb")).containsExactly("a/", "a/b/");
        assertThat(AssetPaths.ancestors("top.nwb")).isEmpty();
    }

    @Test
    void parentAndNameOfLeavesAndDirectories() {
        assertThat(AssetPaths.parentOf("a/b/c.nwb")).isEqualTo("a/b/");
        assertThat(AssetPaths.parentOf("a/b/")).isEqualTo("a/");
        assertThat(AssetPaths.parentOf("a/")).isEmpty();
        assertThat(AssetPaths.parentOf("top.nwb")).isEmpty();

        assertThat(AssetPaths.nameOf("a/b/c.nwb")).isEqualTo("c.nwb");
        assertThat(AssetPaths.nameOf("a/b/")).isEqualTo("b/");
    }

    @Test
    void basenameIsLastSegment() {
        assertThat(AssetPaths.basename("sub-01/a.nwb")).isEqualTo("a.nwb");
        assertThat(AssetPaths.basename("a.nwb")).isEqualTo("a.nwb");
    }
}
