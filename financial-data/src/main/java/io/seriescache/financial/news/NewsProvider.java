package io.seriescache.financial.news;

import java.util.List;

/** What the news listener needs from a news feed connection. */
public interface NewsProvider {
    List<Headline> headlines(NewsFilter filter) throws Exception;

    String story(String storyId) throws Exception;
}
