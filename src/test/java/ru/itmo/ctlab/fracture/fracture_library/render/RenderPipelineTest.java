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

import org.junit.jupiter.api.Test;
import ru.itmo.ctlab.fracture.fracture_library.display.DisplayConfig;
import ru.itmo.ctlab.fracture.fracture_library.display.DisplayMode;
import ru.itmo.ctlab.fracture.fracture_library.error.ErrorKind;
import ru.itmo.ctlab.fracture.fracture_library.error.ImageException;
import ru.itmo.ctlab.fracture.fracture_library.image.ColorImage;
import ru.itmo.ctlab.fracture.fracture_library.image.DepthImage;
import ru.itmo.ctlab.fracture.fracture_library.lighting.LightVector;
import ru.itmo.ctlab.fracture.fracture_library.palette.PaletteFactory;

import java.awt.*;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RenderPipelineTest {

  @Test
  void blackAndWhitePaletteRendersBgra() {
    final var palette = PaletteFactory.createTwoPinPalette(2, Color.BLACK, Color.WHITE);
    final var image = new DepthImage(2, 1, 2);
    image.setPixel(1, 0, 1, LightVector.ZERO);

    final var frame = new RenderPipeline().render(image, palette, new DisplayConfig(), 1.0f);

    assertArrayEquals(new byte[]{0, 0, 0, (byte) 255, (byte) 255, (byte) 255, (byte) 255, (byte) 255}, frame.getData());
  }

  @Test
  void lightIsAddedAfterPalette() {
    final var palette = PaletteFactory.createTwoPinPalette(2, Color.BLACK, Color.WHITE);
    final var image = new DepthImage(1, 1, 2);
    image.setPixel(0, 0, 0, new LightVector(1.0f, 0.0f, 0.0f));

    final var frame = new RenderPipeline().render(image, palette, new DisplayConfig(), 1.0f);

    assertEquals(Color.RED, frame.getPixel(0, 0));
  }

  @Test
  void paletteSizeMustMatchDepth() {
    final var palette = PaletteFactory.createStandardPalette(16);
    final var image = new DepthImage(2, 2, 8);
    assertThrows(IllegalArgumentException.class, () -> new RenderPipeline().render(image, palette, new DisplayConfig(), 1.0f));
    assertThrows(IllegalArgumentException.class, () -> new RenderPipeline().render(image, null, new DisplayConfig(), 1.0f));
  }

  @Test
  void parallelRenderMatchesSequential() {
    final var palette = PaletteFactory.createStandardPalette(256);
    final var image = new DepthImage(32, 16, 256);
    final var random = new Random(17);
    for (int x = 0; x < 32; ++x) {
      for (int y = 0; y < 16; ++y) {
        image.setPixel(x, y, random.nextInt(256), new LightVector(random.nextFloat() * 0.2f, random.nextFloat() * 0.2f, 0.0f));
      }
    }
    final var config = new DisplayConfig();
    config.setMode(DisplayMode.HSL);
    config.setLightness(true);
    config.setHue(true);

    final var sequential = new RenderPipeline(false).render(image, palette, config, 0.8f);
    final var parallel = new RenderPipeline(true).render(image, palette, config, 0.8f);

    assertArrayEquals(sequential.getData(), parallel.getData());
  }

  @Test
  void hslStatisticsComeFromPaletteColorsOfTheImage() {
    // index 1 of a three color black to white palette is (127, 127, 127); white is never drawn
    final var palette = PaletteFactory.createTwoPinPalette(3, Color.BLACK, Color.WHITE);
    final var image = new DepthImage(2, 1, 3);
    image.setPixel(1, 0, 1, LightVector.ZERO);
    final var config = new DisplayConfig();
    config.setMode(DisplayMode.HSL);
    config.setLightness(true);

    final var frame = new RenderPipeline().render(image, palette, config, 1.0f);

    assertArrayEquals(new byte[]{0, 0, 0, (byte) 255, (byte) 255, (byte) 255, (byte) 255, (byte) 255}, frame.getData());
  }

  @Test
  void lightIsAddedAfterHslRemap() {
    final var palette = PaletteFactory.createTwoPinPalette(3, Color.BLACK, Color.WHITE);
    final var image = new DepthImage(2, 1, 3);
    image.setPixel(0, 0, 0, new LightVector(0.0f, 0.0f, 1.0f));
    image.setPixel(1, 0, 1, LightVector.ZERO);
    final var config = new DisplayConfig();
    config.setMode(DisplayMode.HSL);
    config.setLightness(true);

    final var frame = new RenderPipeline().render(image, palette, config, 1.0f);

    assertEquals(Color.BLUE, frame.getPixel(0, 0));
    assertEquals(Color.WHITE, frame.getPixel(1, 0));
  }

  @Test
  void colorImageSkipsLighting() {
    final var image = new ColorImage(1, 1);
    image.setPixel(0, 0, new Color(10, 20, 30, 40));

    final var frame = new RenderPipeline().render(image, null, new DisplayConfig(), 0.0f);

    assertEquals(new Color(10, 20, 30, 40), frame.getPixel(0, 0));
  }

  @Test
  void contrastIsAppliedToColorImages() {
    final var image = new ColorImage(1, 1);
    image.setPixel(0, 0, new Color(200, 150, 150));
    final var config = new DisplayConfig();
    config.setMode(DisplayMode.CONTRAST);
    config.setMinRgb(new int[]{0, 0, 100});
    config.setMaxRgb(new int[]{255, 255, 200});

    final var frame = new RenderPipeline().render(image, null, config, 1.0f);

    assertEquals(new Color(255, 150, 150), frame.getPixel(0, 0));
  }

  @Test
  void lockedTargetFails() {
    final var image = new ColorImage(1, 1);
    final var target = new ByteArrayFrameBuffer(1, 1);
    try (final var ignored = target.lock()) {
      final var e = assertThrows(ImageException.class, () -> new RenderPipeline().render(image, null, new DisplayConfig(), 1.0f, target));
      assertEquals(ErrorKind.FRAME_BUFFER_ACCESS_FAILURE, e.getKind());
    }
  }

  @Test
  void smallTargetIsRejected() {
    final var image = new ColorImage(2, 2);
    assertThrows(IllegalArgumentException.class, () -> new RenderPipeline().render(image, null, new DisplayConfig(), 1.0f, new ByteArrayFrameBuffer(1, 2)));
  }
}
