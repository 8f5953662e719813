package org.stylegen.compiler.icons;

import org.stylegen.compiler.color.ColorValue;
import org.stylegen.compiler.diagnostics.AssetNotFoundException;
import org.stylegen.compiler.diagnostics.CompilerErrorCode;
import org.stylegen.compiler.diagnostics.ModifierIncompatibleException;
import org.stylegen.compiler.diagnostics.SourceLocation;
import org.stylegen.compiler.frontend.resolve.ResolvedExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests asset format detection, density variants and modifier compatibility.
 */
public class IconAssetResolverTest {

    private static final SourceLocation LOCATION = new SourceLocation("icons.style", 3, 7);
    private static final ResolvedExpression WHITE =
            new ResolvedExpression.ColorConstant(ColorValue.parseHex("fff"), Optional.empty());

    private AssetFileSystem fileSystem;
    private IconAssetResolver resolver;

    @BeforeEach
    void setUp() {
        fileSystem = mock(AssetFileSystem.class);
        when(fileSystem.exists(anyString())).thenReturn(false);
        resolver = new IconAssetResolver(fileSystem);
    }

    private static IconLayerRequest layer(String raw) {
        return new IconLayerRequest(IconPathParser.parse(raw, LOCATION), WHITE, LOCATION);
    }

    private IconAsset resolveOne(String raw) {
        return resolver.resolve(List.of(layer(raw))).layers().get(0);
    }

    @Test
    @Tag("unit")
    void vectorAssetWinsOverRaster() {
        when(fileSystem.exists("save.svg")).thenReturn(true);
        when(fileSystem.exists("save.png")).thenReturn(true);

        IconAsset asset = resolveOne("save");

        assertThat(asset.format()).isEqualTo(AssetFormat.VECTOR);
        assertThat(asset.baseFile()).isEqualTo("save.svg");
        verify(fileSystem, never()).exists("save.png");
    }

    @Test
    @Tag("unit")
    void vectorAcceptsForcedSize() {
        when(fileSystem.exists("save.svg")).thenReturn(true);

        IconAsset asset = resolveOne("save-24x24");

        assertThat(asset.forcedSize()).contains(new ForcedSize(24, 24));
        assertThat(asset.variants()).containsExactly(new DensityVariant(1, "save.svg"));
    }

    @Test
    @Tag("unit")
    void vectorRejectsFlip() {
        when(fileSystem.exists("arrow.svg")).thenReturn(true);

        assertThatThrownBy(() -> resolveOne("arrow_flip_horizontal"))
                .isInstanceOf(ModifierIncompatibleException.class)
                .satisfies(e -> assertThat(((ModifierIncompatibleException) e).code())
                        .isEqualTo(CompilerErrorCode.MODIFIER_INCOMPATIBLE));
    }

    @Test
    @Tag("unit")
    void rasterCollectsDensityVariants() {
        when(fileSystem.exists("logo.png")).thenReturn(true);
        when(fileSystem.exists("logo@2x.png")).thenReturn(true);

        IconAsset asset = resolveOne("logo_flip_vertical");

        assertThat(asset.format()).isEqualTo(AssetFormat.RASTER);
        assertThat(asset.variants()).containsExactly(
                new DensityVariant(1, "logo.png"), new DensityVariant(2, "logo@2x.png"));
        assertThat(asset.flip()).contains(FlipAxis.VERTICAL);
    }

    @Test
    @Tag("unit")
    void rasterRejectsForcedSize() {
        when(fileSystem.exists("logo.png")).thenReturn(true);

        assertThatThrownBy(() -> resolveOne("logo-16x16"))
                .isInstanceOf(ModifierIncompatibleException.class)
                .hasMessageContaining("logo.png");
    }

    @Test
    @Tag("unit")
    void missingAssetNamesProbedFiles() {
        assertThatThrownBy(() -> resolveOne("nothing"))
                .isInstanceOf(AssetNotFoundException.class)
                .hasMessageContaining("nothing.svg")
                .hasMessageContaining("nothing.png")
                .satisfies(e -> assertThat(((AssetNotFoundException) e).location()).isEqualTo(LOCATION));
    }

    @Test
    @Tag("integration")
    void parallelProbingKeepsLayerOrderOnDisk(@TempDir Path assets) throws IOException {
        Files.createDirectories(assets.resolve("ui"));
        Files.writeString(assets.resolve("ui/bg.svg"), "<svg/>");
        Files.write(assets.resolve("ui/fg.png"), new byte[]{1});
        Files.write(assets.resolve("ui/fg@3x.png"), new byte[]{1});

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            IconAssetResolver parallel = new IconAssetResolver(new LocalAssetFileSystem(assets), executor);
            ResolvedIcon icon = parallel.resolve(List.of(layer("ui/bg"), layer("ui/fg")));

            assertThat(icon.layers()).extracting(IconAsset::stem).containsExactly("ui/bg", "ui/fg");
            assertThat(icon.layers().get(1).variants()).extracting(DensityVariant::scale).containsExactly(1, 3);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @Tag("integration")
    void localFileSystemDoesNotEscapeRoot(@TempDir Path dir) throws IOException {
        Path root = Files.createDirectories(dir.resolve("assets"));
        Files.writeString(dir.resolve("secret.svg"), "<svg/>");

        assertThat(new LocalAssetFileSystem(root).exists("../secret.svg")).isFalse();
    }
}
