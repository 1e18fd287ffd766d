package com.ficshelf.models;

import com.ficshelf.target.TargetIdentity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class AuthorEntry {

    private final AuthorIdentity identity;
    private final String name;
    private final String url;
    private final String html;
    private final List<TargetIdentity> stories = new ArrayList<>();

    public AuthorEntry(AuthorIdentity identity, String name, String url, String html) {
        this.identity = identity;
        this.name = name;
        this.url = url;
        this.html = html;
    }

    public AuthorIdentity getIdentity() {
        return identity;
    }

    public String getId() {
        return identity.getAuthorId();
    }

    public String getName() {
        return name;
    }

    public String getUrl() {
        return url;
    }

    public String getHtml() {
        return html;
    }

    public List<TargetIdentity> getStories() {
        return Collections.unmodifiableList(stories);
    }

    void addStory(TargetIdentity story) {
        stories.add(story);
    }

    @Override
    public String toString() {
        return "AuthorEntry{" +
            "identity=" + identity +
            ", name='" + name + '\'' +
            ", stories=" + stories.size() +
            '}';
    }
}
