package org.quilkit.compiler.ir;

import org.quilkit.compiler.ir.instruction.Declaration;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshot of a program's memory declarations with {@code SHARING} aliases resolved to
 * their root region.
 */
public final class MemoryLayout {

    private final Map<String, Declaration> declarations;
    private final Map<String, String> roots = new HashMap<>();
    private final Set<String> aliasedRoots = new HashSet<>();

    private MemoryLayout(Map<String, Declaration> declarations) {
        this.declarations = declarations;
        for (String name : declarations.keySet()) {
            String root = resolveRoot(name);
            roots.put(name, root);
            if (declarations.get(name).sharing() != null) {
                aliasedRoots.add(root);
            }
        }
    }

    /**
     * @param declarations The declarations; the first one of each name counts.
     * @return The layout.
     */
    public static MemoryLayout of(Collection<Declaration> declarations) {
        Map<String, Declaration> byName = new HashMap<>();
        for (Declaration declaration : declarations) {
            byName.putIfAbsent(declaration.name(), declaration);
        }
        return new MemoryLayout(Collections.unmodifiableMap(byName));
    }

    public static MemoryLayout empty() {
        return new MemoryLayout(Map.of());
    }

    public Optional<Declaration> declaration(String region) {
        return Optional.ofNullable(declarations.get(region));
    }

    /**
     * @param region A region name.
     * @return The region at the end of its SHARING chain; the smallest member for a SHARING
     *         cycle; the name itself if it shares nothing or is undeclared.
     */
    public String rootOf(String region) {
        return roots.getOrDefault(region, region);
    }

    /**
     * @param region A region name.
     * @return {@code true} if the region shares storage with at least one other region.
     */
    public boolean isAliased(String region) {
        return aliasedRoots.contains(rootOf(region));
    }

    private String resolveRoot(String name) {
        Set<String> seen = new HashSet<>();
        String current = name;
        while (seen.add(current)) {
            Declaration declaration = declarations.get(current);
            if (declaration == null || declaration.sharing() == null) {
                return current;
            }
            current = declaration.sharing().parent();
        }
        return cycleRoot(current);
    }

    /**
     * A cycle of SHARING clauses is one group, named by its smallest member.
     */
    private String cycleRoot(String member) {
        String root = member;
        String current = declarations.get(member).sharing().parent();
        while (!current.equals(member)) {
            if (current.compareTo(root) < 0) {
                root = current;
            }
            current = declarations.get(current).sharing().parent();
        }
        return root;
    }
}
