package com.github.errfix.rule;

import com.github.errfix.tree.Go;
import com.github.errfix.tree.GoNode;
import com.github.errfix.tree.GoStrings;
import com.github.errfix.tree.TokenKind;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the import declarations of a file consistent with a rewrite that started
 * referring to a package.
 */
public final class ImportCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ImportCoordinator.class);

    private static final String CGO = "C";

    /**
     * What {@link #ensureImported} did to the file.
     */
    public enum Outcome {
        ALREADY_IMPORTED,
        REPLACED,
        ADDED
    }

    private ImportCoordinator() {
    }

    /**
     * Makes sure {@code path} is imported exactly once.
     * <p>
     * An existing import of {@code replaces} is rewritten in place, keeping its position
     * and alias. Otherwise a new spec is appended to the first import declaration that
     * does not import {@code "C"}, or a new declaration is inserted after the package
     * clause (or after the last cgo import).
     */
    public static Outcome ensureImported(Go.File file, String path, String replaces) {
        List<Go.GenDecl> imports = importDecls(file);
        if (findImportByPath(imports, path) != null) {
            return Outcome.ALREADY_IMPORTED;
        }
        Go.ImportSpec existing = findImportByPath(imports, replaces);
        if (existing != null) {
            existing.setPath(Go.stringLit(GoStrings.quote(path)));
            LOG.debug("{}: replaced import \"{}\" with \"{}\"", file.getFileName(), replaces, path);
            return Outcome.REPLACED;
        }
        String name = defaultName(path);
        Go.ImportSpec clash = findImportByName(imports, name);
        if (clash != null) {
            // not resolved automatically, the file will not compile until the alias is fixed
            LOG.warn("{}: \"{}\" is already imported as {}, adding \"{}\" anyway",
                    file.getFileName(), importPath(clash), name, path);
        }
        addImport(file, path, imports);
        LOG.debug("{}: added import \"{}\"", file.getFileName(), path);
        return Outcome.ADDED;
    }

    /**
     * Top-level import declarations in source order.
     */
    public static List<Go.GenDecl> importDecls(Go.File file) {
        List<Go.GenDecl> result = new ArrayList<>();
        for (Go.Decl decl : file.getDecls()) {
            if (decl instanceof Go.GenDecl && ((Go.GenDecl) decl).getTok() == TokenKind.IMPORT) {
                result.add((Go.GenDecl) decl);
            }
        }
        return result;
    }

    public static Go.@Nullable ImportSpec findImportByPath(List<Go.GenDecl> imports, String path) {
        for (Go.GenDecl decl : imports) {
            for (Go.Spec spec : decl.getSpecs()) {
                Go.ImportSpec importSpec = (Go.ImportSpec) spec;
                if (path.equals(importPath(importSpec))) {
                    return importSpec;
                }
            }
        }
        return null;
    }

    private static Go.@Nullable ImportSpec findImportByName(List<Go.GenDecl> imports, String name) {
        for (Go.GenDecl decl : imports) {
            for (Go.Spec spec : decl.getSpecs()) {
                Go.ImportSpec importSpec = (Go.ImportSpec) spec;
                if (name.equals(importName(importSpec))) {
                    return importSpec;
                }
            }
        }
        return null;
    }

    /**
     * The unquoted import path, or an empty string when the literal is malformed.
     */
    public static String importPath(Go.ImportSpec spec) {
        return GoStrings.unquote(spec.getPath().getValue()).orElse("");
    }

    /**
     * The name the import binds: its alias, or the last element of its path.
     */
    public static String importName(Go.ImportSpec spec) {
        if (spec.getName() != null) {
            return spec.getName().getName();
        }
        return defaultName(importPath(spec));
    }

    private static String defaultName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }

    private static void addImport(Go.File file, String path, List<Go.GenDecl> imports) {
        Go.ImportSpec spec = new Go.ImportSpec(null, Go.stringLit(GoStrings.quote(path)));
        Go.GenDecl lastCgo = null;
        for (Go.GenDecl decl : imports) {
            if (isCgo(decl)) {
                lastCgo = decl;
            } else {
                decl.getSpecs().add(spec);
                return;
            }
        }
        List<Go.Spec> specs = new ArrayList<>();
        specs.add(spec);
        Go.GenDecl decl = new Go.GenDecl(TokenKind.IMPORT, GoNode.NO_POS, specs, GoNode.NO_POS);
        // the cgo preamble belongs to the comment right before import "C"
        int index = lastCgo == null ? 0 : file.getDecls().indexOf(lastCgo) + 1;
        file.getDecls().add(index, decl);
    }

    private static boolean isCgo(Go.GenDecl decl) {
        for (Go.Spec spec : decl.getSpecs()) {
            if (CGO.equals(importPath((Go.ImportSpec) spec))) {
                return true;
            }
        }
        return false;
    }
}
