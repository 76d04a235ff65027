package com.llestrade.core.chunking;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.llestrade.core.storage.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Counts tokens and splits text into chunks that fit a fraction of a model's context window.
 * <p>
 * Splits prefer markdown headings, then blank-line paragraphs, then whitespace inside an
 * oversized paragraph. Chunks never overlap, so concatenating them reproduces the content
 * up to the whitespace at the seams.
 */
@Service
public class ChunkingEngine {

    private static final Logger log = LoggerFactory.getLogger(ChunkingEngine.class);

    private static final Pattern HEADING = Pattern.compile("(?m)^(?=#{1,6}\\s)");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final String JOINER = "\n\n";

    static final long MAX_CACHE_ENTRIES = 10_000;

    private final Cache<String, Integer> tokenCache;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ChunkingEngine() {
        this(MAX_CACHE_ENTRIES);
    }

    ChunkingEngine(long maxCacheEntries) {
        this.tokenCache = Caffeine.newBuilder()
                .maximumSize(maxCacheEntries)
                .executor(Runnable::run)
                .build();
    }

    public int countTokens(ModelTarget target, String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        String key = ContentHasher.sha256(text) + ":" + target.provider().name() + ":" + target.model();
        Integer cached = tokenCache.getIfPresent(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        int tokens = target.provider().countTokens(text, target.model());
        tokenCache.put(key, tokens);
        return tokens;
    }

    public TokenCacheStats cacheStats() {
        tokenCache.cleanUp();
        return new TokenCacheStats(hits.get(), misses.get(), tokenCache.estimatedSize());
    }

    /** {@code floor(utilization * contextWindow)}, at least 1. */
    public int tokenBudget(ModelTarget target, double utilization) {
        return Math.max(1, (int) Math.floor(target.contextWindow() * utilization));
    }

    public List<Chunk> chunk(String text, ModelTarget target, double utilization) {
        return chunkToBudget(text, target, tokenBudget(target, utilization));
    }

    /**
     * Splits {@code text} so every chunk counts at most {@code budget} tokens.
     */
    public List<Chunk> chunkToBudget(String text, ModelTarget target, int budget) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        int total = countTokens(target, text);
        if (total <= budget) {
            return List.of(new Chunk(1, text, total));
        }

        List<String> pieces = new ArrayList<>();
        for (String section : HEADING.split(text)) {
            if (section.isBlank()) {
                continue;
            }
            if (countTokens(target, section) <= budget) {
                pieces.add(section.strip());
                continue;
            }
            for (String paragraph : PARAGRAPH_BREAK.split(section)) {
                if (paragraph.isBlank()) {
                    continue;
                }
                if (countTokens(target, paragraph) <= budget) {
                    pieces.add(paragraph.strip());
                } else {
                    pieces.addAll(hardSplit(paragraph.strip(), target, budget));
                }
            }
        }

        List<Chunk> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String piece : pieces) {
            if (current.length() == 0) {
                current.append(piece);
                continue;
            }
            String candidate = current + JOINER + piece;
            if (countTokens(target, candidate) <= budget) {
                current.append(JOINER).append(piece);
            } else {
                addChunk(chunks, current.toString(), target);
                current.setLength(0);
                current.append(piece);
            }
        }
        if (current.length() > 0) {
            addChunk(chunks, current.toString(), target);
        }
        log.debug("Split {} tokens into {} chunks (budget {})", total, chunks.size(), budget);
        return chunks;
    }

    private void addChunk(List<Chunk> chunks, String text, ModelTarget target) {
        chunks.add(new Chunk(chunks.size() + 1, text, countTokens(target, text)));
    }

    /**
     * Character splits for a paragraph that alone exceeds the budget, cut at the last whitespace
     * before the estimated limit where one exists.
     */
    private List<String> hardSplit(String paragraph, ModelTarget target, int budget) {
        List<String> parts = new ArrayList<>();
        String rest = paragraph;
        while (!rest.isEmpty() && countTokens(target, rest) > budget) {
            int tokens = countTokens(target, rest);
            int limit = Math.max(1, (int) ((long) rest.length() * budget / tokens));
            int cut = cutPoint(rest, limit);
            String head = rest.substring(0, cut);
            while (cut > 1 && countTokens(target, head) > budget) {
                cut = cutPoint(rest, cut - Math.max(1, cut / 10));
                head = rest.substring(0, cut);
            }
            if (!head.isBlank()) {
                parts.add(head.strip());
            }
            rest = rest.substring(cut).stripLeading();
        }
        if (!rest.isBlank()) {
            parts.add(rest);
        }
        return parts;
    }

    private static int cutPoint(String text, int limit) {
        int max = Math.min(Math.max(1, limit), text.length());
        for (int i = max; i > max / 2; i--) {
            if (Character.isWhitespace(text.charAt(i - 1))) {
                return i;
            }
        }
        return max;
    }
}
