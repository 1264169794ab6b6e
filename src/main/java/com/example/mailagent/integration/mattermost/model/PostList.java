package com.example.mailagent.integration.mattermost.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PostList {
    private List<String> order = new ArrayList<>();
    private Map<String, Post> posts = new HashMap<>();
}
