package typesafeschwalbe.blockgraph.types;

import org.hamcrest.MatcherAssert;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import typesafeschwalbe.blockgraph.ErrorException;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

public class TypeContextTest {

    private TypeContext ctx;

    @Before
    public void setUp() {
        ctx = new TypeContext();
    }

    @Test
    public void unifyBindsVariableToConstructor() throws ErrorException {
        TypeExpr a = ctx.makeVar();
        ctx.unify(a, ctx.makeInt());
        Assert.assertEquals(DataType.Type.INTEGER, ctx.get(a).type);
        Assert.assertFalse(ctx.isUnbound(a));
    }

    @Test
    public void unifyIsSymmetricForVariables() throws ErrorException {
        TypeExpr a = ctx.makeVar();
        TypeExpr b = ctx.makeVar();
        ctx.unify(b, a);
        ctx.unify(ctx.makeFloat(), b);
        Assert.assertEquals(ctx.resolve(a), ctx.resolve(b));
        Assert.assertEquals(DataType.Type.FLOAT, ctx.get(a).type);
    }

    @Test
    public void unifyIsIdempotent() throws ErrorException {
        TypeExpr a = ctx.makeVar();
        TypeExpr list = ctx.makeList(a);
        TypeExpr ints = ctx.makeList(ctx.makeInt());
        ctx.unify(list, ints);
        int nodes = ctx.nodeCount();
        ctx.unify(list, ints);
        Assert.assertEquals(nodes, ctx.nodeCount());
        Assert.assertEquals("List(Int)", ctx.display(list));
    }

    @Test
    public void unifyDescendsIntoConstructors() throws ErrorException {
        TypeExpr a = ctx.makeVar();
        TypeExpr b = ctx.makeVar();
        TypeExpr fun = ctx.makeClosure(a, b);
        ctx.unify(fun, ctx.makeClosure(ctx.makeBool(), ctx.makePair(a, a)));
        Assert.assertEquals(DataType.Type.BOOLEAN, ctx.get(a).type);
        Assert.assertEquals("Pair(Bool, Bool)", ctx.display(b));
        Assert.assertEquals("Fun(Bool, Pair(Bool, Bool))", ctx.display(fun));
    }

    @Test
    public void mismatchedConstructorsAreRejected() {
        ErrorException e = Assert.assertThrows(ErrorException.class,
            () -> ctx.unify(ctx.makeInt(), ctx.makeBool()));
        MatcherAssert.assertThat(
            e.error.message(), containsString("Incompatible types")
        );
    }

    @Test
    public void mismatchMessageNamesThePath() {
        TypeExpr left = ctx.makePair(ctx.makeInt(), ctx.makeVar());
        TypeExpr right = ctx.makePair(ctx.makeFloat(), ctx.makeVar());
        ErrorException e = Assert.assertThrows(ErrorException.class,
            () -> ctx.unify(left, right));
        MatcherAssert.assertThat(
            e.error.message(), containsString("the first pair elements")
        );
    }

    @Test
    public void occursCheckRejectsInfiniteTypes() {
        TypeExpr a = ctx.makeVar();
        TypeExpr list = ctx.makeList(a);
        ErrorException e = Assert.assertThrows(ErrorException.class,
            () -> ctx.unify(a, list));
        MatcherAssert.assertThat(
            e.error.message(), containsString("Infinite type")
        );
        Assert.assertTrue(ctx.isUnbound(a));
    }

    @Test
    public void canUnifyNeverMutates() {
        TypeExpr a = ctx.makeVar();
        TypeExpr b = ctx.makeVar();
        TypeExpr pair = ctx.makePair(a, b);
        TypeExpr concrete = ctx.makePair(ctx.makeInt(), ctx.makeFloat());
        Assert.assertTrue(ctx.canUnify(pair, concrete));
        Assert.assertTrue(ctx.isUnbound(a));
        Assert.assertTrue(ctx.isUnbound(b));
        Assert.assertTrue(ctx.canUnify(a, ctx.makeBool()));
        Assert.assertTrue(ctx.isUnbound(a));
    }

    @Test
    public void canUnifyFollowsTentativeBindings() {
        TypeExpr a = ctx.makeVar();
        TypeExpr left = ctx.makePair(a, a);
        TypeExpr right = ctx.makePair(ctx.makeInt(), ctx.makeBool());
        Assert.assertFalse(ctx.canUnify(left, right));
        Assert.assertTrue(ctx.isUnbound(a));
    }

    @Test
    public void clearDetachesVariables() throws ErrorException {
        TypeExpr a = ctx.makeVar();
        ctx.unify(a, ctx.makeInt());
        ctx.clear(a);
        Assert.assertTrue(ctx.isUnbound(a));
        Assert.assertEquals(ctx.resolve(a), a);
    }

    @Test
    public void clearKeepsConstructorShape() throws ErrorException {
        TypeExpr element = ctx.makeVar();
        TypeExpr list = ctx.makeList(element);
        ctx.unify(element, ctx.makeFloat());
        ctx.clear(list);
        Assert.assertEquals(DataType.Type.LIST, ctx.get(list).type);
        Assert.assertTrue(ctx.isUnbound(element));
    }

    @Test
    public void deepEqualsComparesResolvedStructure() throws ErrorException {
        TypeExpr a = ctx.makeVar();
        TypeExpr left = ctx.makeList(a);
        TypeExpr right = ctx.makeList(ctx.makeInt());
        Assert.assertFalse(ctx.deepEquals(left, right));
        ctx.unify(a, ctx.makeInt());
        Assert.assertTrue(ctx.deepEquals(left, right));
        MatcherAssert.assertThat(ctx.display(left), is(ctx.display(right)));
    }

    @Test
    public void deepUnificationDoesNotOverflow() throws ErrorException {
        TypeExpr left = ctx.makeVar();
        TypeExpr right = ctx.makeInt();
        TypeExpr leftLeaf = left;
        for(int depth = 0; depth < 20_000; depth += 1) {
            left = ctx.makeList(left);
            right = ctx.makeList(right);
        }
        ctx.unify(left, right);
        Assert.assertEquals(DataType.Type.INTEGER, ctx.get(leftLeaf).type);
    }

}
