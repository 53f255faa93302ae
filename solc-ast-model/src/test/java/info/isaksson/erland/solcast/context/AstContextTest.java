package info.isaksson.erland.solcast.context;

import info.isaksson.erland.solcast.error.DuplicateIdentityException;
import info.isaksson.erland.solcast.error.UnresolvedReferenceException;
import info.isaksson.erland.solcast.node.AstNode;
import info.isaksson.erland.solcast.node.decl.VariableDeclaration;
import info.isaksson.erland.solcast.node.expr.Identifier;
import info.isaksson.erland.solcast.node.meta.SourceUnit;
import info.isaksson.erland.solcast.node.stmt.Block;
import info.isaksson.erland.solcast.node.stmt.ExpressionStatement;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AstContextTest {

    @Test
    void registersAndResolvesByIdentity() {
        AstContext ctx = new AstContext();
        SourceUnit unit = new SourceUnit(1, null);
        ctx.register(unit);

        assertSame(unit, ctx.resolve(1));
        assertSame(unit, ctx.resolve(1, SourceUnit.class));
        assertSame(ctx, unit.getContext());
        assertEquals(1, ctx.size());
        assertThrows(UnresolvedReferenceException.class, () -> ctx.resolve(1, Block.class));
    }

    @Test
    void rejectsDuplicateIdentity() {
        AstContext ctx = new AstContext();
        ctx.register(new SourceUnit(7, null));
        DuplicateIdentityException e = assertThrows(DuplicateIdentityException.class,
                () -> ctx.register(new Block(7, null)));
        assertEquals(7, e.getIdentity());
        assertEquals("SourceUnit", e.getExistingKind());
        assertEquals(1, ctx.size());
    }

    @Test
    void unknownIdentityFailsToResolve() {
        AstContext ctx = new AstContext();
        UnresolvedReferenceException open = assertThrows(UnresolvedReferenceException.class, () -> ctx.resolve(42));
        assertEquals(42, open.getIdentity());
        assertTrue(open.getMessage().contains("still open"));

        ctx.closeRegistration();
        assertTrue(ctx.isRegistrationClosed());
        UnresolvedReferenceException closed = assertThrows(UnresolvedReferenceException.class, () -> ctx.resolve(42));
        assertTrue(closed.getMessage().contains("registration is closed"));
        assertTrue(ctx.lookup(42).isEmpty());
    }

    @Test
    void adoptedSubtreesAreRegistered() {
        AstContext ctx = new AstContext();
        SourceUnit unit = new SourceUnit(1, null);
        ctx.register(unit);

        Block block = new Block(10, null);
        ExpressionStatement stmt = new ExpressionStatement(11, null);
        stmt.setExpression(new Identifier(12, null));
        block.getStatements().add(stmt);
        unit.getNodes().add(block);

        assertTrue(ctx.contains(10));
        assertTrue(ctx.contains(11));
        assertTrue(ctx.contains(12));
        assertSame(ctx, stmt.getExpression().getContext());
    }

    @Test
    void syntheticIdentitiesNeverCollide() {
        AstContext ctx = new AstContext();
        SourceUnit unit = new SourceUnit(100, null);
        ctx.register(unit);
        ctx.register(new Block(5, null));

        long id = ctx.newSyntheticId();
        assertTrue(id > 100);
        Block synthetic = new Block(id, null);
        unit.getNodes().add(synthetic);
        assertSame(synthetic, ctx.resolve(id));
        assertTrue(ctx.newSyntheticId() > id);
    }

    @Test
    void removedNodesResolveToUnknown() {
        AstContext ctx = new AstContext();
        SourceUnit unit = new SourceUnit(1, null);
        ctx.register(unit);
        VariableDeclaration decl = new VariableDeclaration(2, null);
        unit.getNodes().add(decl);
        ctx.closeRegistration();

        NodeRef ref = ctx.reference(2);
        assertTrue(ref.isResolved());
        assertSame(decl, ref.target().orElseThrow());
        assertSame(decl, ref.target(VariableDeclaration.class).orElseThrow());
        assertTrue(ref.target(Block.class).isEmpty());

        decl.remove();

        assertTrue(ctx.wasRemoved(2));
        assertFalse(ctx.contains(2));
        assertFalse(ref.isResolved());
        assertTrue(ref.target().isEmpty());
        assertTrue(decl.getParent().isEmpty());
        assertTrue(unit.getNodes().isEmpty());
    }

    @Test
    void externalReferencesResolveToUnknown() {
        AstContext ctx = new AstContext();
        ctx.register(new SourceUnit(1, null));

        NodeRef builtin = ctx.reference(-15);
        assertThrows(UnresolvedReferenceException.class, builtin::target);
        builtin.markExternal();
        assertTrue(builtin.isExternal());
        assertFalse(builtin.isResolved());
        assertTrue(builtin.target().isEmpty());
        assertEquals("ref#-15(external)", builtin.toString());

        NodeRef local = NodeRef.to(ctx.resolve(1));
        assertEquals(1, local.getId());
        assertEquals(List.of(builtin, local), ctx.references());
    }

    @Test
    void referenceToFreeStandingNodeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> NodeRef.to(new Block(3, null)));
        assertThrows(IllegalArgumentException.class, () -> NodeRef.to(null));
    }

    @Test
    void usageIndexDropsRemovedUsers() {
        AstContext ctx = new AstContext();
        SourceUnit unit = new SourceUnit(1, null);
        ctx.register(unit);
        VariableDeclaration decl = new VariableDeclaration(2, null);
        Block block = new Block(3, null);
        ExpressionStatement first = new ExpressionStatement(4, null);
        Identifier a = new Identifier(5, null);
        first.setExpression(a);
        ExpressionStatement second = new ExpressionStatement(6, null);
        Identifier b = new Identifier(7, null);
        second.setExpression(b);
        block.getStatements().add(first);
        block.getStatements().add(second);
        unit.getNodes().add(decl);
        unit.getNodes().add(block);

        Map<Long, List<AstNode>> index = new LinkedHashMap<>();
        index.put(2L, List.of(a, b));
        ctx.replaceUsages(index);
        assertEquals(List.of(a, b), ctx.usagesOf(decl));
        assertTrue(ctx.usagesOf(block).isEmpty());

        first.remove();
        assertEquals(List.of(b), ctx.usagesOf(decl));

        decl.remove();
        assertTrue(ctx.usagesOf(decl).isEmpty());
    }
}
