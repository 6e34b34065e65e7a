package org.storagelayout.compiler.semantics;

import org.storagelayout.compiler.api.CompilerErrorCode;
import org.storagelayout.compiler.api.SourceInfo;
import org.storagelayout.compiler.diagnostics.DiagnosticsEngine;
import org.storagelayout.compiler.internal.i18n.Messages;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Builds the scope tree consumed by the layout pass and owns the symbol arena.
 * Symbols receive consecutive ids in creation order, which the layout pass uses as a
 * stable ordering key.
 */
public class SymbolTable {

    private final Scope rootScope;
    private Scope currentScope;
    private final DiagnosticsEngine diagnostics;
    private final List<Symbol> arena = new ArrayList<>();

    /**
     * Constructs a new symbol table with an empty global scope.
     * @param diagnostics The diagnostics engine for reporting errors.
     */
    public SymbolTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.rootScope = new Scope(Scope.Kind.GLOBAL, null, null, false);
        this.currentScope = this.rootScope;
    }

    public Scope rootScope() {
        return rootScope;
    }

    public Scope currentScope() {
        return currentScope;
    }

    /**
     * Enters a new scope nested in the current one.
     * @param kind The kind of the new scope.
     * @param scopeSymbol The symbol naming the scope, may be null.
     * @return The new scope.
     */
    public Scope enterScope(Scope.Kind kind, Symbol scopeSymbol) {
        return enter(new Scope(kind, currentScope, scopeSymbol, false));
    }

    /**
     * Enters the scope of an instantiation of a kind-parameterized derived type.
     * @param typeSymbol The symbol of the derived type.
     * @return The new scope.
     */
    public Scope enterInstantiation(Symbol typeSymbol) {
        return enter(new Scope(Scope.Kind.DERIVED_TYPE, currentScope, typeSymbol, true));
    }

    private Scope enter(Scope newScope) {
        currentScope.addChild(newScope);
        currentScope = newScope;
        return newScope;
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     */
    public void leaveScope() {
        if (currentScope.parent() != null) {
            currentScope = currentScope.parent();
        }
    }

    /**
     * Sets the current scope to the given scope.
     * @param scope The scope to set as current.
     */
    public void setCurrentScope(Scope scope) {
        this.currentScope = scope;
    }

    /**
     * Declares a new symbol in the current scope.
     * Reports an error and returns the existing symbol if the name is already declared there.
     * @param name The name.
     * @param source The declaration site.
     * @param details The symbol details.
     * @param attrs The attributes.
     * @return The declared symbol.
     */
    public Symbol declare(String name, SourceInfo source, SymbolDetails details, Attr... attrs) {
        String key = name.toUpperCase(Locale.ROOT);
        if (currentScope.contains(key)) {
            diagnostics.reportError(CompilerErrorCode.DUPLICATE_SYMBOL, Messages.get("symbol.duplicate", key), source);
            return currentScope.find(key).orElseThrow();
        }
        Symbol symbol = create(name, source, details, attrs);
        currentScope.add(symbol);
        return symbol;
    }

    /**
     * Creates a symbol owned by the current scope without making it visible by name,
     * such as the specific procedure hidden by a generic interface of the same name.
     * @param name The name.
     * @param source The declaration site.
     * @param details The symbol details.
     * @param attrs The attributes.
     * @return The new symbol.
     */
    public Symbol declareShadowed(String name, SourceInfo source, SymbolDetails details, Attr... attrs) {
        return create(name, source, details, attrs);
    }

    private Symbol create(String name, SourceInfo source, SymbolDetails details, Attr... attrs) {
        EnumSet<Attr> set = EnumSet.noneOf(Attr.class);
        set.addAll(Arrays.asList(attrs));
        Symbol symbol = new Symbol(arena.size(), name, source, currentScope, set, details);
        arena.add(symbol);
        return symbol;
    }

    /**
     * Declares a data object in the current scope.
     * @param name The name.
     * @param source The declaration site.
     * @param type The declared type.
     * @param shape The array shape.
     * @param attrs The attributes.
     * @return The declared symbol.
     */
    public Symbol declareObject(String name, SourceInfo source, DeclaredType type, ArraySpec shape, Attr... attrs) {
        return declare(name, source, new SymbolDetails.ObjectEntity(type, shape), attrs);
    }

    /**
     * Adds an EQUIVALENCE set to the current scope.
     * @param objects The objects of the set.
     * @return The new set.
     */
    public EquivalenceSet equivalence(EquivalenceObject... objects) {
        EquivalenceSet set = EquivalenceSet.of(objects);
        currentScope.addEquivalenceSet(set);
        return set;
    }

    /**
     * Adds members to a COMMON block of the current scope, creating the block on first use.
     * Members are marked as belonging to the block.
     * @param name The block name, empty for blank COMMON.
     * @param source The site of the COMMON statement.
     * @param members The members in declaration order.
     * @return The block.
     */
    public CommonBlock common(String name, SourceInfo source, Symbol... members) {
        Scope scope = currentScope;
        CommonBlock block = scope.commonBlock(name).orElseGet(() -> {
            CommonBlock created = new CommonBlock(name, source, scope);
            scope.addCommonBlock(created);
            return created;
        });
        for (Symbol member : members) {
            block.add(member);
            member.setCommonBlock(block);
        }
        return block;
    }

    /**
     * @param id A symbol id.
     * @return The symbol with that id.
     */
    public Symbol symbol(int id) {
        return arena.get(id);
    }

    public int symbolCount() {
        return arena.size();
    }
}
