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
package ru.itmo.ctlab.fracture.fracture_server.dto;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;
import ru.itmo.ctlab.fracture.fracture_library.lighting.LightVector;
import ru.itmo.ctlab.fracture.fracture_server.dto.request.render.ColorRenderRequestDTO;
import ru.itmo.ctlab.fracture.fracture_server.dto.request.render.DepthRenderRequestDTO;

import java.awt.*;

import static org.junit.jupiter.api.Assertions.*;

class RenderRequestDTOTest {

  private static JsonObject depthRequest(final int width, final int height) {
    return new JsonObject()
      .put("width", width)
      .put("height", height)
      .put("pixels", new JsonArray());
  }

  @Test
  void depthRequestNeedsPositiveDimensions() {
    assertThrows(IllegalArgumentException.class, () -> DepthRenderRequestDTO.fromJSONObject(depthRequest(-2, 3)));
    assertThrows(IllegalArgumentException.class, () -> DepthRenderRequestDTO.fromJSONObject(depthRequest(3, -1)));
    assertThrows(IllegalArgumentException.class, () -> DepthRenderRequestDTO.fromJSONObject(depthRequest(0, 0)));
  }

  @Test
  void colorRequestNeedsPositiveDimensions() {
    final var negative = new JsonObject().put("width", 2).put("height", -4).put("colors", new JsonArray());
    final var empty = new JsonObject().put("width", 0).put("height", 1).put("colors", new JsonArray());
    assertThrows(IllegalArgumentException.class, () -> ColorRenderRequestDTO.fromJSONObject(negative));
    assertThrows(IllegalArgumentException.class, () -> ColorRenderRequestDTO.fromJSONObject(empty));
  }

  @Test
  void depthRequestReadsColumns() {
    final var json = new JsonObject()
      .put("width", 2)
      .put("height", 1)
      .put("pixels", new JsonArray().add(new JsonArray().add(3)).add(new JsonArray().add(5)))
      .put("lighting", new JsonArray()
        .add(new JsonArray().add(new JsonArray().add(0.5).add(0.0).add(0.0)))
        .add(new JsonArray().add(new JsonArray().add(0.0).add(0.0).add(1.0))));

    final var request = DepthRenderRequestDTO.fromJSONObject(json);
    assertNull(request.ambientPower());

    final var image = request.toEntity(8);
    assertEquals(2, image.getWidth());
    assertEquals(1, image.getHeight());
    assertEquals(3, image.getPixel(0, 0));
    assertEquals(5, image.getPixel(1, 0));
    assertEquals(new LightVector(0.5f, 0.0f, 0.0f), image.getLighting(0, 0));
    assertEquals(new LightVector(0.0f, 0.0f, 1.0f), image.getLighting(1, 0));
  }

  @Test
  void colorRequestReadsArgbColumns() {
    final var json = new JsonObject()
      .put("width", 1)
      .put("height", 2)
      .put("colors", new JsonArray().add(new JsonArray().add(0xFFFF0000L).add(0x800000FFL)));

    final var image = ColorRenderRequestDTO.fromJSONObject(json).toEntity();
    assertEquals(Color.RED, image.getPixel(0, 0));
    assertEquals(new Color(0, 0, 255, 128), image.getPixel(0, 1));
  }

  @Test
  void columnCountMustMatchWidth() {
    final var json = new JsonObject()
      .put("width", 2)
      .put("height", 1)
      .put("pixels", new JsonArray().add(new JsonArray().add(0)));
    assertThrows(IllegalArgumentException.class, () -> DepthRenderRequestDTO.fromJSONObject(json));
  }
}
