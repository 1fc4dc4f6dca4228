package org.quilkit.compiler.frontend.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A symbol table for managing scopes and symbols during validation.
 * <p>
 * The root scope holds the program body; every definition body with instructions opens a
 * child scope. Labels are local to the scope they are defined in, all other names are
 * resolved from the current scope upwards to the root. The first definition of a name
 * wins; later ones are kept only so that duplicates can be reported with every location.
 */
public class SymbolTable {

    /**
     * Represents a single scope in the symbol table.
     */
    public static class Scope {
        private final Scope parent;
        private final List<Scope> children = new ArrayList<>();
        private final Map<Symbol.Type, Map<String, List<Symbol>>> symbols = new EnumMap<>(Symbol.Type.class);

        Scope(Scope parent) {
            this.parent = parent;
        }

        void addChild(Scope child) {
            children.add(child);
        }

        private Optional<Symbol> lookup(String name, Symbol.Type type) {
            Map<String, List<Symbol>> byName = symbols.get(type);
            if (byName == null) {
                return Optional.empty();
            }
            List<Symbol> defined = byName.get(name);
            return defined == null ? Optional.empty() : Optional.of(defined.get(0));
        }
    }

    private final Scope rootScope;
    private Scope currentScope;

    public SymbolTable() {
        this.rootScope = new Scope(null);
        this.currentScope = this.rootScope;
    }

    /**
     * Resets the current scope to the root scope.
     */
    public void resetScope() {
        this.currentScope = this.rootScope;
    }

    /**
     * Enters a new child scope of the current one.
     * @return The new scope.
     */
    public Scope enterScope() {
        Scope newScope = new Scope(currentScope);
        currentScope.addChild(newScope);
        currentScope = newScope;
        return newScope;
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     */
    public void leaveScope() {
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
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
     * Defines a symbol in the current scope.
     * @param symbol The symbol to define.
     * @return {@code true} if this is the first definition of the name in this scope.
     */
    public boolean define(Symbol symbol) {
        List<Symbol> defined = currentScope.symbols
                .computeIfAbsent(symbol.type(), t -> new LinkedHashMap<>())
                .computeIfAbsent(symbol.name(), n -> new ArrayList<>());
        defined.add(symbol);
        return defined.size() == 1;
    }

    /**
     * Resolves a name. Labels are only searched in the current scope, every other type
     * from the current scope upwards to the root.
     *
     * @param name The name to resolve.
     * @param type The namespace to search.
     * @return The first definition, or empty if the name is not defined.
     */
    public Optional<Symbol> resolve(String name, Symbol.Type type) {
        if (type == Symbol.Type.LABEL) {
            return currentScope.lookup(name, type);
        }
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Optional<Symbol> found = scope.lookup(name, type);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns every name of the current scope that is defined more than once.
     * @param type The namespace to inspect.
     * @return One list of definitions per duplicated name, in order of first definition.
     */
    public List<List<Symbol>> duplicates(Symbol.Type type) {
        Map<String, List<Symbol>> byName = currentScope.symbols.get(type);
        if (byName == null) {
            return List.of();
        }
        List<List<Symbol>> result = new ArrayList<>();
        for (List<Symbol> defined : byName.values()) {
            if (defined.size() > 1) {
                result.add(Collections.unmodifiableList(defined));
            }
        }
        return result;
    }
}
