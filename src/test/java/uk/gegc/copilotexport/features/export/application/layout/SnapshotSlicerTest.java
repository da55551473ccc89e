package uk.gegc.copilotexport.features.export.application.layout;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.copilotexport.features.export.domain.model.Snapshot;
import uk.gegc.copilotexport.features.export.domain.model.layout.BlockKind;
import uk.gegc.copilotexport.features.export.domain.model.layout.FontSpec;
import uk.gegc.copilotexport.features.export.domain.model.layout.ImageSlice;
import uk.gegc.copilotexport.features.export.domain.model.layout.PageLayout;
import uk.gegc.copilotexport.features.export.domain.model.layout.PaginatedDocument;
import uk.gegc.copilotexport.features.export.domain.model.layout.TextBlock;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SnapshotSlicer Tests")
class SnapshotSlicerTest {

    private static final PageLayout PAGE = new PageLayout(700f, 1000f, 0f, 0f, 0f, 0f);

    private SnapshotSlicer slicer;

    @BeforeEach
    void setUp() {
        slicer = new SnapshotSlicer();
    }

    @Test
    @DisplayName("slice: 800x2500 bitmap at width 700 gives slices of 1000, 1000 and the remainder")
    void slice_dashboardScenario_threeSlices() {
        // When
        PaginatedDocument document = slicer.slice(snapshot(800, 2500), new PageComposer(PAGE));

        // Then
        List<ImageSlice> slices = document.imageSlices();
        assertThat(document.pageCount()).isEqualTo(3);
        assertThat(slices).hasSize(3);
        assertThat(slices.get(0).height()).isCloseTo(1000f, within(0.001f));
        assertThat(slices.get(1).height()).isCloseTo(1000f, within(0.001f));
        assertThat(slices.get(2).height()).isCloseTo(187.5f, within(0.001f));
        double total = slices.stream().mapToDouble(ImageSlice::height).sum();
        assertThat(total).isCloseTo(2500 * (700.0 / 800.0), within(0.01));
        assertThat(slices).allSatisfy(slice -> assertThat(slice.width()).isEqualTo(700f));
    }

    @Test
    @DisplayName("slice: source bands are contiguous and cover the bitmap exactly once")
    void slice_sourceBandsContiguous() {
        List<ImageSlice> slices = slicer.slice(snapshot(800, 2500), new PageComposer(PAGE)).imageSlices();

        assertThat(slices.get(0).sourceY()).isZero();
        for (int i = 1; i < slices.size(); i++) {
            assertThat(slices.get(i).sourceY()).isEqualTo(slices.get(i - 1).sourceEndY());
        }
        assertThat(slices.get(slices.size() - 1).sourceEndY()).isEqualTo(2500);
        assertThat(slices.stream().mapToInt(ImageSlice::sourceHeight).sum()).isEqualTo(2500);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 500, 1142, 1143, 1144, 2286, 4000, 11429})
    @DisplayName("slice: slice count is the scaled height divided by the page height, rounded up")
    void slice_sliceCountIsCeilOfScaledHeight(int height) {
        // Given
        double scaledHeight = height * (700.0 / 800.0);

        // When
        PaginatedDocument document = slicer.slice(snapshot(800, height), new PageComposer(PAGE));

        // Then
        List<ImageSlice> slices = document.imageSlices();
        assertThat(slices).hasSize((int) Math.ceil(scaledHeight / 1000.0));
        assertThat(slices.stream().mapToDouble(ImageSlice::height).sum()).isCloseTo(scaledHeight, within(0.01));
        assertThat(slices.get(slices.size() - 1).sourceEndY()).isEqualTo(height);
    }

    @Test
    @DisplayName("slice: first slice uses only the space left below earlier blocks")
    void slice_afterTitle_firstSliceUsesRemainingSpace() {
        // Given
        PageComposer composer = new PageComposer(PAGE);
        composer.place(new TextBlock(BlockKind.TITLE, "Insights Dashboard Export", FontSpec.bold(16f), 100f));

        // When
        List<ImageSlice> slices = slicer.slice(snapshot(800, 2500), composer).imageSlices();

        // Then
        assertThat(slices.get(0).height()).isCloseTo(900f, within(0.001f));
        assertThat(slices.get(1).height()).isCloseTo(1000f, within(0.001f));
        assertThat(slices.get(2).height()).isCloseTo(287.5f, within(0.001f));
    }

    @Test
    @DisplayName("slice: image shorter than the page becomes a single slice on one page")
    void slice_shortImage_singleSlice() {
        PaginatedDocument document = slicer.slice(snapshot(1400, 300), new PageComposer(PAGE));

        assertThat(document.pageCount()).isEqualTo(1);
        assertThat(document.imageSlices()).singleElement()
                .satisfies(slice -> assertThat(slice.height()).isCloseTo(150f, within(0.001f)));
    }

    private Snapshot snapshot(int width, int height) {
        return new Snapshot(new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB));
    }
}
