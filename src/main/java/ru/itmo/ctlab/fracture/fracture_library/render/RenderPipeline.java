/*
 * MIT License
 *
 * Copyright (c) 2021-2024. Aleksandr Serdiukov, Anton Zamyatin, Aleksandr Sinitsyn, Vitalii Dravgelis and Computer Technologies Laboratory ITMO University team.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ru.itmo.ctlab.fracture.fracture_library.render;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import ru.itmo.ctlab.fracture.fracture_library.display.DisplayConfig;
import ru.itmo.ctlab.fracture.fracture_library.display.DisplayTransform;
import ru.itmo.ctlab.fracture.fracture_library.image.ColorImage;
import ru.itmo.ctlab.fracture.fracture_library.image.DepthImage;
import ru.itmo.ctlab.fracture.fracture_library.image.RawLightedImage;
import ru.itmo.ctlab.fracture.fracture_library.lighting.LightingCompositor;
import ru.itmo.ctlab.fracture.fracture_library.palette.Colormap;

import java.awt.*;
import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Turns a {@link RawLightedImage} into BGRA pixels: base color (palette lookup or stored color),
 * then the display transform, then lighting (depth images only).
 * <p>
 * Columns are independent once the transform is built, so they may be processed in parallel.
 * The palette must not be edited while a render is running.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class RenderPipeline {
  private final boolean parallel;

  public RenderPipeline() {
    this(false);
  }

  public void render(final @NotNull RawLightedImage image, final @Nullable Colormap palette, final @NotNull DisplayConfig config, final float ambientPower, final @NotNull FrameBuffer target) {
    if (image instanceof DepthImage depthImage) {
      if (palette == null) {
        throw new IllegalArgumentException("Depth image cannot be rendered without a palette");
      }
      renderDepth(depthImage, palette, config, ambientPower, target);
    } else {
      renderColor(image.asColorImage(), config, target);
    }
  }

  public @NotNull ByteArrayFrameBuffer render(final @NotNull RawLightedImage image, final @Nullable Colormap palette, final @NotNull DisplayConfig config, final float ambientPower) {
    final var target = new ByteArrayFrameBuffer(image.getWidth(), image.getHeight());
    render(image, palette, config, ambientPower, target);
    return target;
  }

  public void renderDepth(final @NotNull DepthImage image, final @NotNull Colormap palette, final @NotNull DisplayConfig config, final float ambientPower, final @NotNull FrameBuffer target) {
    if (palette.getNumberOfColors() != image.getDepth()) {
      throw new IllegalArgumentException("Palette has " + palette.getNumberOfColors() + " colors but image depth is " + image.getDepth());
    }
    checkTarget(image, target);
    log.debug("Rendering " + image.getWidth() + "x" + image.getHeight() + " depth image in " + config.getMode().getDescription() + " display mode");

    final var width = image.getWidth();
    final var height = image.getHeight();
    final var baseColors = new Color[width][height];
    forEachColumn(width, x -> {
      for (int y = 0; y < height; ++y) {
        baseColors[x][y] = palette.getColor(image.getPixel(x, y));
      }
    });

    final var transform = DisplayTransform.create(config, baseColors);

    try (final var frame = target.lock()) {
      forEachColumn(width, x -> {
        for (int y = 0; y < height; ++y) {
          final var displayed = transform.apply(baseColors[x][y]);
          frame.writePixel(x, y, LightingCompositor.calculateLight(displayed, image.getLighting(x, y), ambientPower));
        }
      });
    }
  }

  public void renderColor(final @NotNull ColorImage image, final @NotNull DisplayConfig config, final @NotNull FrameBuffer target) {
    checkTarget(image, target);
    log.debug("Rendering " + image.getWidth() + "x" + image.getHeight() + " color image in " + config.getMode().getDescription() + " display mode");

    final var width = image.getWidth();
    final var height = image.getHeight();
    final var baseColors = new Color[width][height];
    for (int x = 0; x < width; ++x) {
      for (int y = 0; y < height; ++y) {
        baseColors[x][y] = image.getPixel(x, y);
      }
    }

    final var transform = DisplayTransform.create(config, baseColors);

    try (final var frame = target.lock()) {
      forEachColumn(width, x -> {
        for (int y = 0; y < height; ++y) {
          frame.writePixel(x, y, transform.apply(baseColors[x][y]));
        }
      });
    }
  }

  private void forEachColumn(final int width, final @NotNull IntConsumer column) {
    final var columns = IntStream.range(0, width);
    (this.parallel ? columns.parallel() : columns).forEach(column);
  }

  private static void checkTarget(final @NotNull RawLightedImage image, final @NotNull FrameBuffer target) {
    if (target.getWidth() < image.getWidth() || target.getHeight() < image.getHeight()) {
      throw new IllegalArgumentException("Frame buffer " + target.getWidth() + "x" + target.getHeight() + " is smaller than image " + image.getWidth() + "x" + image.getHeight());
    }
  }
}
