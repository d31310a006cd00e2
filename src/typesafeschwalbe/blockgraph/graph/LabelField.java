package typesafeschwalbe.blockgraph.graph;

public class LabelField extends Field {

    private String text;

    public LabelField(String text) {
        this.text = text;
    }

    @Override
    public boolean isSerializable() {
        return false;
    }

    @Override
    public String getValue() {
        return this.text;
    }

    @Override
    public String setValue(String value) {
        String old = this.text;
        this.text = value;
        return old;
    }

}
