package com.flamingo.ai.slidedeck.service.compiler;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.apache.poi.sl.usermodel.PictureData.PictureType;

/** Detects the picture type of raw image bytes and checks that they decode. */
final class PictureFormats {

  private PictureFormats() {}

  /**
   * Detects the format of an image from its magic numbers, then decodes it fully.
   *
   * @throws IOException if the bytes are not a PNG, JPEG, GIF or BMP image, or do not decode
   */
  static PictureType detect(byte[] data) throws IOException {
    PictureType type = sniff(data);
    BufferedImage decoded;
    try {
      decoded = ImageIO.read(new ByteArrayInputStream(data));
    } catch (RuntimeException e) {
      throw new IOException("Image data could not be decoded: " + e.getMessage(), e);
    }
    if (decoded == null) {
      throw new IOException("Image data could not be decoded as " + type);
    }
    return type;
  }

  private static PictureType sniff(byte[] data) throws IOException {
    if (data == null || data.length < 4) {
      throw new IOException("Image data is empty or truncated");
    }
    if ((data[0] & 0xff) == 0x89 && data[1] == 'P' && data[2] == 'N' && data[3] == 'G') {
      return PictureType.PNG;
    }
    if ((data[0] & 0xff) == 0xff && (data[1] & 0xff) == 0xd8) {
      return PictureType.JPEG;
    }
    if (data[0] == 'G' && data[1] == 'I' && data[2] == 'F') {
      return PictureType.GIF;
    }
    if (data[0] == 'B' && data[1] == 'M') {
      return PictureType.BMP;
    }
    throw new IOException("Unsupported or undecodable image format");
  }
}
