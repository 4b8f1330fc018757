package software.amazon.fuzzy.matcher;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static software.amazon.fuzzy.matcher.Automaton.ROOT;

/**
 * Collects words with their ids and compiles them into an {@link Automaton}: the words are inserted into a trie,
 * then one breadth-first pass computes the suffix links and a second one the terminal links. The terminal link
 * pass needs every suffix link to be final, so the two cannot be merged.
 */
public class AutomatonBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(AutomatonBuilder.class);

    private final List<String> words = new ArrayList<>();
    private final IntList ids = new IntArrayList();

    /**
     * Adds a word to be matched. The same word may be added several times under different ids; the empty word
     * matches at every position.
     *
     * @param word the word
     * @param id the id reported when the word is matched
     * @return this builder
     */
    public AutomatonBuilder add(@Nonnull final String word, final int id) {
        words.add(Objects.requireNonNull(word, "word"));
        ids.add(id);
        return this;
    }

    /**
     * Builds a new automaton over all the words added so far. Each call returns an independent automaton.
     *
     * @return the automaton
     */
    public Automaton build() {
        final Automaton automaton = new Automaton();

        buildTrie(automaton);
        buildSuffixLinks(automaton);
        buildTerminalLinks(automaton);

        LOG.debug("Built automaton with {} nodes from {} words", automaton.size(), words.size());
        return automaton;
    }

    private void buildTrie(final Automaton automaton) {
        for (int i = 0; i < words.size(); i++) {
            automaton.addString(words.get(i), ids.getInt(i));
        }
    }

    private static void buildSuffixLinks(final Automaton automaton) {
        BreadthFirstSearch.traverse(ROOT, new AutomatonGraph(automaton),
                new SuffixLinkCalculator(automaton).visitor());
    }

    private static void buildTerminalLinks(final Automaton automaton) {
        BreadthFirstSearch.traverse(ROOT, new AutomatonGraph(automaton),
                new TerminalLinkCalculator(automaton).visitor());
    }
}
