package com.github.errfix.rule;

import com.github.errfix.parser.GoParser;
import com.github.errfix.parser.ParseException;
import com.github.errfix.tree.Go;
import com.github.errfix.tree.GoPrinter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ImportCoordinatorTest {

    @Test
    void alreadyImportedLeavesFileUntouched() throws Exception {
        String src = "package foo\n\nimport \"github.com/pkg/errors\"\n";
        Go.File file = parse(src);

        assertThat(ImportCoordinator.ensureImported(file, "github.com/pkg/errors", "errors"))
                .isEqualTo(ImportCoordinator.Outcome.ALREADY_IMPORTED);
        assertThat(GoPrinter.print(file)).isEqualTo(src);
    }

    @Test
    void replacesPathInPlace() throws Exception {
        Go.File file = parse("package foo\n\nimport e \"errors\" // std\n");

        assertThat(ImportCoordinator.ensureImported(file, "github.com/pkg/errors", "errors"))
                .isEqualTo(ImportCoordinator.Outcome.REPLACED);
        assertThat(GoPrinter.print(file)).isEqualTo("package foo\n\nimport e \"github.com/pkg/errors\" // std\n");
    }

    @Test
    void appendsToFirstImportDeclaration() throws Exception {
        Go.File file = parse("package foo\n\nimport (\n\t\"fmt\"\n)\n\nimport \"os\"\n");

        assertThat(ImportCoordinator.ensureImported(file, "github.com/pkg/errors", "errors"))
                .isEqualTo(ImportCoordinator.Outcome.ADDED);
        assertThat(GoPrinter.print(file))
                .isEqualTo("package foo\n\nimport (\n\t\"fmt\"\n\t\"github.com/pkg/errors\"\n)\n\nimport \"os\"\n");
    }

    @Test
    void insertsDeclarationWhenFileHasNoImports() throws Exception {
        Go.File file = parse("package foo\n\nvar x = 1\n");

        assertThat(ImportCoordinator.ensureImported(file, "github.com/pkg/errors", "errors"))
                .isEqualTo(ImportCoordinator.Outcome.ADDED);
        assertThat(GoPrinter.print(file))
                .isEqualTo("package foo\n\nimport (\n\t\"github.com/pkg/errors\"\n)\n\nvar x = 1\n");
    }

    @Test
    void cgoImportKeepsItsPreamble() throws Exception {
        Go.File file = parse("package foo\n\n// #include <stdio.h>\nimport \"C\"\n\nimport \"fmt\"\n");

        assertThat(ImportCoordinator.ensureImported(file, "github.com/pkg/errors", "errors"))
                .isEqualTo(ImportCoordinator.Outcome.ADDED);
        assertThat(GoPrinter.print(file)).isEqualTo(
                "package foo\n\n// #include <stdio.h>\nimport \"C\"\n\nimport (\n\t\"fmt\"\n\t\"github.com/pkg/errors\"\n)\n");
    }

    @Test
    void insertsDeclarationAfterLoneCgoImport() throws Exception {
        Go.File file = parse("package foo\n\n// #include <stdio.h>\nimport \"C\"\n\nfunc f() {}\n");

        assertThat(ImportCoordinator.ensureImported(file, "github.com/pkg/errors", "errors"))
                .isEqualTo(ImportCoordinator.Outcome.ADDED);
        assertThat(GoPrinter.print(file)).isEqualTo(
                "package foo\n\n// #include <stdio.h>\nimport \"C\"\n\n"
                        + "import (\n\t\"github.com/pkg/errors\"\n)\n\nfunc f() {}\n");
    }

    @Test
    void packageClauseCommentStaysOnItsLine() throws Exception {
        Go.File file = parse("package foo // import \"example.com/foo\"\n\nvar x = 1\n");

        ImportCoordinator.ensureImported(file, "github.com/pkg/errors", "errors");

        assertThat(GoPrinter.print(file)).isEqualTo("package foo // import \"example.com/foo\"\n\n"
                + "import (\n\t\"github.com/pkg/errors\"\n)\n\nvar x = 1\n");
    }

    @Test
    void blockCommentAfterLastSpecStaysOnItsLine() throws Exception {
        Go.File file = parse("package foo\n\nimport (\n\t\"fmt\" /* formatting */\n)\n");

        ImportCoordinator.ensureImported(file, "github.com/pkg/errors", "errors");

        assertThat(GoPrinter.print(file))
                .isEqualTo("package foo\n\nimport (\n\t\"fmt\" /* formatting */\n\t\"github.com/pkg/errors\"\n)\n");
    }

    @Test
    void importNames() throws Exception {
        Go.File file = parse("package foo\n\nimport (\n\tstd \"errors\"\n\t\"github.com/pkg/errors\"\n)\n");
        List<Go.GenDecl> imports = ImportCoordinator.importDecls(file);

        Go.ImportSpec aliased = ImportCoordinator.findImportByPath(imports, "errors");
        Go.ImportSpec plain = ImportCoordinator.findImportByPath(imports, "github.com/pkg/errors");
        assertThat(aliased).isNotNull();
        assertThat(plain).isNotNull();
        assertThat(ImportCoordinator.importName(aliased)).isEqualTo("std");
        assertThat(ImportCoordinator.importName(plain)).isEqualTo("errors");
        assertThat(ImportCoordinator.findImportByPath(imports, "fmt")).isNull();
    }

    private static Go.File parse(String src) throws ParseException {
        return new GoParser("foo.go", src).parseFile();
    }
}
