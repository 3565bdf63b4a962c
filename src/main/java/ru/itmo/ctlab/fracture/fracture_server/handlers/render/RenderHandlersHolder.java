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
package ru.itmo.ctlab.fracture.fracture_server.handlers.render;

import io.vertx.core.Vertx;
import io.vertx.core.json.Json;
import io.vertx.ext.web.Router;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.render.ByteArrayFrameBuffer;
import ru.itmo.ctlab.fracture.fracture_library.render.RenderPipeline;
import ru.itmo.ctlab.fracture.fracture_server.HandlersHolder;
import ru.itmo.ctlab.fracture.fracture_server.dto.request.render.ColorRenderRequestDTO;
import ru.itmo.ctlab.fracture.fracture_server.dto.request.render.DepthRenderRequestDTO;
import ru.itmo.ctlab.fracture.fracture_server.dto.response.render.RenderedFrameDTO;
import ru.itmo.ctlab.fracture.fracture_server.util.shareable.ShareableWrappers;

@RequiredArgsConstructor
@Slf4j
public class RenderHandlersHolder extends HandlersHolder {
  private final Vertx vertx;

  @Override
  public void addHandlersToRouter(final @NotNull Router router) {
    router.post("/render_depth").blockingHandler(ctx -> {
      log.debug("Entered blockingHandler");
      final var request = DepthRenderRequestDTO.fromJSONObject(ctx.body().asJsonObject());

      final var map = vertx.sharedData().getLocalMap("fracture_server");
      final var paletteWrapper = (ShareableWrappers.PaletteWrapper) map.get("palette");
      if (paletteWrapper == null) {
        ctx.fail(new RuntimeException("Palette is not present in the local map"));
        return;
      }
      final var configWrapper = (ShareableWrappers.DisplayConfigWrapper) map.get("displayConfig");
      if (configWrapper == null) {
        ctx.fail(new RuntimeException("Display options are not present in the local map"));
        return;
      }
      final float ambientPower = (request.ambientPower() != null) ? request.ambientPower() : (float) map.get("ambientPower");
      final var pipeline = new RenderPipeline((boolean) map.get("renderParallel"));

      final ByteArrayFrameBuffer frame;
      final var lock = paletteWrapper.getLock();
      try {
        lock.readLock().lock();
        final var palette = paletteWrapper.getPalette();
        final var image = request.toEntity(palette.getNumberOfColors());
        frame = pipeline.render(image, palette, configWrapper.getDisplayConfig(), ambientPower);
      } finally {
        lock.readLock().unlock();
      }
      log.debug("Rendered depth image " + frame.getWidth() + "x" + frame.getHeight());
      ctx.response().setStatusCode(200).end(Json.encode(RenderedFrameDTO.fromEntity(frame)));
    });

    router.post("/render_color").blockingHandler(ctx -> {
      log.debug("Entered blockingHandler");
      final var request = ColorRenderRequestDTO.fromJSONObject(ctx.body().asJsonObject());

      final var map = vertx.sharedData().getLocalMap("fracture_server");
      final var configWrapper = (ShareableWrappers.DisplayConfigWrapper) map.get("displayConfig");
      if (configWrapper == null) {
        ctx.fail(new RuntimeException("Display options are not present in the local map"));
        return;
      }
      final var pipeline = new RenderPipeline((boolean) map.get("renderParallel"));
      final var frame = pipeline.render(request.toEntity(), null, configWrapper.getDisplayConfig(), 1.0f);
      log.debug("Rendered color image " + frame.getWidth() + "x" + frame.getHeight());
      ctx.response().setStatusCode(200).end(Json.encode(RenderedFrameDTO.fromEntity(frame)));
    });
  }
}
