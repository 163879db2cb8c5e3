package com.onthegomap.geoscene.entity;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.geoscene.entity.graphics.Color;
import org.junit.jupiter.api.Test;

class DefaultStylesTest {

  @Test
  void testDefaults() {
    DefaultStyles styles = new DefaultStyles();
    assertEquals(DefaultStyles.DEFAULT_POINT_ID, styles.getPoint().getId());
    assertEquals(Color.YELLOW, styles.getPoint().getPoint().getColor());
    assertEquals(10d, styles.getPoint().getPoint().getPixelSize());

    assertEquals(2d, styles.getLine().getPolyline().getWidth());
    assertNull(styles.getLine().getPolygon());

    assertEquals(Color.fromBytes(255, 255, 0, 25), styles.getPolygon().getPolygon().getMaterial().color());
    assertEquals(0d, styles.getPolygon().getPolyline().getOutlineWidth());
  }

  @Test
  void testFactoriesReturnFreshTemplates() {
    assertNotSame(DefaultStyles.defaultLine(), DefaultStyles.defaultLine());
    assertNotSame(new DefaultStyles().getLine().getPolyline(), new DefaultStyles().getLine().getPolyline());
  }

  @Test
  void testTemplatesAreRequired() {
    DefaultStyles styles = new DefaultStyles();
    assertThrows(NullPointerException.class, () -> styles.setPolygon(null));
  }
}
