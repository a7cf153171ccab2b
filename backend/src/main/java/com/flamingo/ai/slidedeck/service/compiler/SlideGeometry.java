package com.flamingo.ai.slidedeck.service.compiler;

import com.flamingo.ai.slidedeck.domain.ir.SlideElement;
import java.awt.Dimension;
import java.awt.geom.Rectangle2D;
import org.apache.poi.util.Units;

/**
 * Converts IR geometry (inches) into the drawing units of the POI shape API (points, 72 per inch).
 * The container itself stores EMU, 914400 per inch; POI does that last conversion.
 */
public final class SlideGeometry {

  public static final double CANVAS_WIDTH_INCHES = 13.333;
  public static final double CANVAS_HEIGHT_INCHES = 7.5;

  private SlideGeometry() {}

  public static double toPoints(double inches) {
    return inches * Units.POINT_DPI;
  }

  public static double toInches(double points) {
    return points / Units.POINT_DPI;
  }

  /** Page size of a blank document: 16:9 widescreen. */
  public static Dimension canvasSize() {
    return new Dimension(
        (int) Math.round(toPoints(CANVAS_WIDTH_INCHES)),
        (int) Math.round(toPoints(CANVAS_HEIGHT_INCHES)));
  }

  public static Rectangle2D anchorOf(SlideElement element) {
    return anchor(element.x(), element.y(), element.width(), element.height());
  }

  public static Rectangle2D anchor(double x, double y, double width, double height) {
    return new Rectangle2D.Double(toPoints(x), toPoints(y), toPoints(width), toPoints(height));
  }
}
