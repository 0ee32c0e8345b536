package org.dandiarchive.archive.core.asset;

import org.dandiarchive.archive.core.error.ContentRefConflictException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class AssetContentTest {

    @Test
    void exactlyOneReferenceSelectsTheVariant() {
        assertThat(AssetContent.of(1L, null, null)).isEqualTo(new AssetContent.BlobContent(1));
        assertThat(AssetContent.of(null, 2L, null)).isEqualTo(new AssetContent.EmbargoedBlobContent(2));
        assertThat(AssetContent.of(null, null, 3L)).isEqualTo(new AssetContent.ZarrContent(3));
    }

    @Test
    void noneOrSeveralReferencesConflict() {
        assertThatThrownBy(() -> AssetContent.of(null, null, null)).isInstanceOf(ContentRefConflictException.class);
        assertThatThrownBy(() -> AssetContent.of(1L, null, 3L)).isInstanceOf(ContentRefConflictException.class);
    }

    @Test
    void columnsMirrorTheVariant() {
        AssetContent zarr = new AssetContent.ZarrContent(3);

        assertThat(zarr.isZarr()).isTrue();
        assertThat(zarr.zarrColumn()).isEqualTo(3L);
        assertThat(zarr.blobColumn()).isNull();
        assertThat(zarr.embargoedBlobColumn()).isNull();
    }
}
