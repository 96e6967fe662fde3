package se.kth.patchmerge.matching;

import com.github.gumtreediff.matchers.CompositeMatchers;
import com.github.gumtreediff.matchers.MappingStore;
import com.github.gumtreediff.matchers.Matcher;
import com.github.gumtreediff.matchers.Matchers;
import com.github.gumtreediff.tree.Tree;
import se.kth.patchmerge.exception.MergeException;
import se.kth.patchmerge.util.LazyLogger;

import java.util.function.Supplier;

/**
 * {@link TreeMatcher} backed by GumTree. A fresh GumTree matcher is created for every call, so a single instance can
 * serve concurrent merges.
 */
public class GumTreeMatcher implements TreeMatcher {
    private static final LazyLogger LOGGER = new LazyLogger(GumTreeMatcher.class);

    private final Supplier<Matcher> matcherFactory;
    private final String name;

    /**
     * Create a matcher that uses GumTree's classic matching algorithm (greedy top-down, then bottom-up).
     */
    public GumTreeMatcher() {
        this(CompositeMatchers.ClassicGumtree::new, "classic-gumtree");
    }

    private GumTreeMatcher(Supplier<Matcher> matcherFactory, String name) {
        this.matcherFactory = matcherFactory;
        this.name = name;
    }

    /**
     * Create a matcher from GumTree's matcher registry.
     *
     * @param matcherId Id of a registered GumTree matcher, or null for the classic GumTree matcher.
     * @return A tree matcher.
     * @throws MergeException If no matcher is registered under the given id.
     */
    public static GumTreeMatcher fromId(String matcherId) {
        if (matcherId == null) {
            return new GumTreeMatcher();
        }
        if (Matchers.getInstance().getMatcher(matcherId) == null) {
            throw new MergeException("Unknown GumTree matcher: " + matcherId);
        }
        return new GumTreeMatcher(() -> Matchers.getInstance().getMatcher(matcherId), matcherId);
    }

    @Override
    public MappingStore match(Tree src, Tree dst) {
        MappingStore mappings = matcherFactory.get().match(src, dst);
        LOGGER.debug(() -> name + " matched " + mappings.size() + " node pairs");
        return mappings;
    }

    @Override
    public String toString() {
        return "GumTreeMatcher{" + name + "}";
    }
}
