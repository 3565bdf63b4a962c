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
package ru.itmo.ctlab.fracture.fracture_server.dto.response.render;

import org.jetbrains.annotations.NotNull;
import ru.itmo.ctlab.fracture.fracture_library.render.ByteArrayFrameBuffer;

import java.util.Base64;

/**
 * Rendered BGRA bytes, base64 encoded, rows {@code stride} bytes apart.
 */
public record RenderedFrameDTO(int width, int height, int stride, @NotNull String bgraBase64) {
  public static @NotNull RenderedFrameDTO fromEntity(final @NotNull ByteArrayFrameBuffer frameBuffer) {
    return new RenderedFrameDTO(
      frameBuffer.getWidth(),
      frameBuffer.getHeight(),
      frameBuffer.getStride(),
      Base64.getEncoder().encodeToString(frameBuffer.getData())
    );
  }
}
