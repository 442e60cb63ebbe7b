package org.gts3.atlantis.stuckpoint.fixtures;

public class ShapeHarness {

    public static void fuzzerTestOneInput(byte[] data) {
        Shape shape;
        if (data.length > 1) {
            shape = new Square(data[0]);
        } else {
            shape = new Circle(1);
        }
        if (shape.area() > 100) {
            deepCheck(shape);
        }
    }

    static void deepCheck(Shape shape) {
        String description = shape.describe();
        if (description.length() > 20) {
            throw new IllegalStateException(description);
        }
    }

    public static void unused() {
        new Square(2).area();
    }
}
