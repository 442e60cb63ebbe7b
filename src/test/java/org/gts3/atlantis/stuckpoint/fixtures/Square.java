package org.gts3.atlantis.stuckpoint.fixtures;

public class Square implements Shape {
    private final int side;

    public Square(int side) {
        this.side = side;
    }

    @Override
    public int area() {
        if (side < 0) {
            return 0;
        }
        return side * side;
    }
}
