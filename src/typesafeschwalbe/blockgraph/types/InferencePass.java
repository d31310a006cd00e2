package typesafeschwalbe.blockgraph.types;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import typesafeschwalbe.blockgraph.Error;
import typesafeschwalbe.blockgraph.ErrorException;

/**
 * One best-effort inference run. A failed unification is recorded against the
 * socket it happened at and inference carries on with the next constraint.
 */
public class InferencePass {

    private static final Logger LOG = LogManager.getLogger(InferencePass.class);

    /**
     * A place in the graph a type mismatch can be reported against.
     */
    public interface Site {
        String blockId();
        String siteName();
        void reportTypeError(Error error);
    }

    private final TypeContext ctx;
    private final List<Error> errors;

    public InferencePass(TypeContext ctx) {
        this.ctx = ctx;
        this.errors = new ArrayList<>();
    }

    public TypeContext context() {
        return this.ctx;
    }

    public List<Error> errors() {
        return List.copyOf(this.errors);
    }

    public boolean unify(TypeExpr actual, TypeExpr expected, Site site) {
        try {
            this.ctx.unify(actual, expected);
            return true;
        } catch(ErrorException e) {
            Error located = new Error(
                e.error.message(),
                Error.Marking.info(
                    site.blockId(), site.siteName(),
                    "this expects " + this.ctx.display(expected)
                ),
                Error.Marking.error(
                    site.blockId(), site.siteName(),
                    "but receives " + this.ctx.display(actual)
                )
            );
            LOG.debug(
                "Type mismatch at block {} socket {}: {}",
                site.blockId(), site.siteName(), e.error.message()
            );
            this.errors.add(located);
            site.reportTypeError(located);
            return false;
        }
    }

}
