package models;

import com.fasterxml.jackson.databind.node.ObjectNode;
import play.libs.Json;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Immutable bundle of the five text counts:
 * <ul>
 *     <li>symbols (code points without newlines, ellipsis counted once)</li>
 *     <li>characters (letters and digits)</li>
 *     <li>words</li>
 *     <li>sentences</li>
 *     <li>syllables (summed per word)</li>
 * </ul>
 *
 * <p>Instances are built by {@link util.TextStats#buildAggregateStats(String)}
 * and are never cached; every field can be recomputed from the source text by
 * its own counter.</p>
 */
public final class TextStatistics {
    private final int symbols;
    private final int characters;
    private final int words;
    private final int sentences;
    private final int syllables;

    public TextStatistics(int symbols, int characters, int words, int sentences, int syllables) {
        this.symbols = symbols;
        this.characters = characters;
        this.words = words;
        this.sentences = sentences;
        this.syllables = syllables;
    }

    public int getSymbols() {
        return symbols;
    }

    public int getCharacters() {
        return characters;
    }

    public int getWords() {
        return words;
    }

    public int getSentences() {
        return sentences;
    }

    public int getSyllables() {
        return syllables;
    }

    /**
     * Writes one {@code label:<TAB>value} line per count.
     *
     * @param out target stream
     */
    public void print(PrintStream out) {
        out.println("Symbols:\t" + symbols);
        out.println("Characters:\t" + characters);
        out.println("Words:\t\t" + words);
        out.println("Sentences:\t" + sentences);
        out.println("Syllables:\t" + syllables);
    }

    public ObjectNode toJson() {
        ObjectNode node = Json.newObject();
        node.put("symbols", symbols);
        node.put("characters", characters);
        node.put("words", words);
        node.put("sentences", sentences);
        node.put("syllables", syllables);
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextStatistics)) return false;
        TextStatistics that = (TextStatistics) o;
        return symbols == that.symbols &&
                characters == that.characters &&
                words == that.words &&
                sentences == that.sentences &&
                syllables == that.syllables;
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbols, characters, words, sentences, syllables);
    }

    @Override
    public String toString() {
        return "TextStatistics{" +
                "symbols=" + symbols +
                ", characters=" + characters +
                ", words=" + words +
                ", sentences=" + sentences +
                ", syllables=" + syllables +
                '}';
    }
}
