package com.github.errfix;

import com.github.errfix.parser.GoParser;
import com.github.errfix.parser.ParseException;
import com.github.errfix.tree.Go;
import com.github.errfix.tree.GoPrinter;
import com.github.errfix.tree.RenderException;

/**
 * {@link GoSyntax} backed by {@link GoParser} and {@link GoPrinter}.
 */
public class LosslessGoSyntax implements GoSyntax {

    @Override
    public Go.File parse(String fileName, String source) throws ParseException {
        return new GoParser(fileName, source).parseFile();
    }

    @Override
    public String print(Go.File file) throws RenderException {
        return GoPrinter.print(file);
    }
}
