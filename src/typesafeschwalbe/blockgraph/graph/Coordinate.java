package typesafeschwalbe.blockgraph.graph;

public record Coordinate(double x, double y) {

    public static final Coordinate ORIGIN = new Coordinate(0, 0);

    public Coordinate translate(double dx, double dy) {
        return new Coordinate(this.x + dx, this.y + dy);
    }

}
