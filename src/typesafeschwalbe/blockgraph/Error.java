package typesafeschwalbe.blockgraph;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

public record Error(String message, Error.Marking... markings) {

    public static record Marking(
        Type type, String blockId, Optional<String> socket, String note
    ) {

        public enum Type {
            ERROR('^', Color.RED),
            INFO('~', Color.BRIGHT_BLUE),
            HELP('*', Color.GREEN);

            private final char marker;
            private final String color;

            private Type(char marker, String color) {
                this.marker = marker;
                this.color = color;
            }
        }

        public static Marking error(String blockId, String note) {
            return new Marking(Type.ERROR, blockId, Optional.empty(), note);
        }

        public static Marking error(
            String blockId, String socket, String note
        ) {
            return new Marking(Type.ERROR, blockId, Optional.of(socket), note);
        }

        public static Marking info(String blockId, String note) {
            return new Marking(Type.INFO, blockId, Optional.empty(), note);
        }

        public static Marking info(
            String blockId, String socket, String note
        ) {
            return new Marking(Type.INFO, blockId, Optional.of(socket), note);
        }

        public static Marking help(String blockId, String note) {
            return new Marking(Type.HELP, blockId, Optional.empty(), note);
        }

        public String location() {
            return "block '" + this.blockId + "'"
                + this.socket.map(s -> ", socket '" + s + "'").orElse("");
        }

    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Error)) { return false; }
        Error other = (Error) otherRaw;
        return this.message.equals(other.message)
            && Arrays.equals(this.markings, other.markings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.message, Arrays.hashCode(this.markings));
    }

    @Override
    public String toString() {
        return this.render(false);
    }

    public String render(boolean colored) {
        StringBuilder output = new StringBuilder();
        output.append(Color.paint(colored, "error: ", Color.BOLD, Color.RED));
        output.append(Color.paint(colored, this.message, Color.RED));
        output.append("\n");
        for(Marking marked: this.markings) {
            output.append("  ");
            output.append(Color.paint(colored, "╭─ ", Color.GRAY));
            output.append(Color.paint(colored, marked.location(), Color.GRAY));
            output.append("\n");
            output.append("  ");
            output.append(Color.paint(colored, "┊ ", Color.GRAY));
            output.append(Color.paint(
                colored, marked.type.marker + " " + marked.note,
                marked.type.color
            ));
            output.append("\n");
        }
        return output.toString();
    }

}
