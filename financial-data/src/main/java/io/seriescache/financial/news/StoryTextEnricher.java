package io.seriescache.financial.news;

import io.seriescache.batch.ContentEnricher;
import io.seriescache.batch.DataRecord;
import io.seriescache.cache.CachingLoader;
import io.seriescache.cache.Codec;
import io.seriescache.cache.ContentCache;

/**
 * Adds the full story under field {@code text}, read through the content cache under {@code story_<id>}.
 */
public class StoryTextEnricher implements ContentEnricher {
    public static final String TEXT = "text";
    static final String KEY_PREFIX = "story_";

    private final NewsProvider provider;
    private final CachingLoader<String, String> loader;

    public StoryTextEnricher(NewsProvider provider, ContentCache cache) {
        this.provider = provider;
        this.loader = new CachingLoader<>(cache, Codec.utf8(), Codec.utf8());
    }

    @Override
    public DataRecord enrich(DataRecord record) {
        String storyId = record.getString(Headline.STORY_ID);
        String text = loader.load(KEY_PREFIX + storyId, key -> provider.story(storyId));
        return record.with(TEXT, text);
    }
}
