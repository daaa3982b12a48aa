package dumb.narsese.format;

import dumb.narsese.ast.Narsese;
import dumb.narsese.parse.NarseseFolder;

/**
 * Writes typed values by unfolding them to a lexical tree and formatting that.
 */
public class NarseseFormatter {

    private final NarseseFolder folder;
    private final LexicalFormatter lexical;

    public NarseseFormatter(NarseseFormat format) {
        this.folder = new NarseseFolder(format);
        this.lexical = new LexicalFormatter(format);
    }

    public NarseseFormat format() {
        return lexical.format();
    }

    public String format(Narsese n) {
        return lexical.format(folder.unfold(n));
    }
}
