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
package ru.itmo.ctlab.fracture.fracture_library.display;

import org.junit.jupiter.api.Test;

import java.awt.*;

import static org.junit.jupiter.api.Assertions.*;

class DisplayTransformTest {
  private static final Color[][] RED_AND_BLUE = {{Color.RED, Color.BLUE}};

  @Test
  void offModeIsIdentity() {
    assertSame(DisplayTransform.IDENTITY, DisplayTransform.create(new DisplayConfig(), RED_AND_BLUE));
  }

  @Test
  void hslModeWithoutChannelsIsIdentity() {
    final var config = new DisplayConfig();
    config.setMode(DisplayMode.HSL);
    assertSame(DisplayTransform.IDENTITY, DisplayTransform.create(config, RED_AND_BLUE));
  }

  @Test
  void contrastModeBuildsContrastTransform() {
    final var config = new DisplayConfig();
    config.setMode(DisplayMode.CONTRAST);
    assertInstanceOf(ContrastTransform.class, DisplayTransform.create(config, RED_AND_BLUE));
  }

  @Test
  void statisticsCoverEnabledChannelsOnly() {
    final var statistics = HslStatistics.scan(RED_AND_BLUE, true, false, false);
    assertNotNull(statistics.hue());
    assertEquals(0.0d, statistics.hue().min(), 1e-9);
    assertEquals(240.0d, statistics.hue().max(), 1e-9);
    assertNull(statistics.saturation());
    assertNull(statistics.lightness());
  }

  @Test
  void degenerateRangeKeepsUnitScale() {
    final var range = new ChannelRange(0.5d, 0.5d);
    assertTrue(range.isDegenerate());
    assertEquals(1.0d, range.scaleFactorTo(0.0d, 1.0d));
    assertEquals(2.0d, new ChannelRange(0.25d, 0.75d).scaleFactorTo(0.0d, 1.0d));
  }
}
