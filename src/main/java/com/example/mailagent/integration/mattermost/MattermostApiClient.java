package com.example.mailagent.integration.mattermost;

import com.example.mailagent.config.MailAgentProperties;
import com.example.mailagent.integration.mattermost.model.OpenDialogRequest;
import com.example.mailagent.integration.mattermost.model.PatchPostRequest;
import com.example.mailagent.integration.mattermost.model.Post;
import com.example.mailagent.integration.mattermost.model.PostList;
import com.example.mailagent.integration.mattermost.model.SendPostRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Service
public class MattermostApiClient {

    private static final Logger log = LoggerFactory.getLogger(MattermostApiClient.class);
    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String bearerToken;

    public MattermostApiClient(RestTemplateBuilder restTemplateBuilder, MailAgentProperties properties) {
        Duration timeout = properties.getRetry().getCallTimeout();
        this.restTemplate = restTemplateBuilder
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .build();
        this.baseUrl = properties.getMattermost().getBaseUrl();
        this.bearerToken = properties.getMattermost().getToken();
    }

    private HttpHeaders createHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(bearerToken);
        headers.set(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        return headers;
    }

    /**
     * Send Post
     * curl --request POST
     * --url http://localhost:8065/api/v4/posts
     * --header 'Accept: application/json'
     * --header 'Authorization: Bearer 123'
     * --header 'Content-Type: application/json'
     * --data '{ "channel_id": "string", "message": "string", "root_id": "string", "props": { "attachments": [] } }'
     */
    public Post sendPost(SendPostRequest request) {
        String url = baseUrl + "/posts";
        HttpHeaders headers = createHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<SendPostRequest> entity = new HttpEntity<>(request, headers);

        ResponseEntity<Post> response = restTemplate.exchange(
                url,
                HttpMethod.POST,
                entity,
                Post.class
        );
        log.debug("Post created in channel {}: {}", request.getChannel_id(), response.getStatusCode());
        return response.getBody();
    }

    /**
     * Patch Post
     * curl --request PUT
     * --url http://localhost:8065/api/v4/posts/{post_id}/patch
     * --header 'Authorization: Bearer 123'
     * --header 'Content-Type: application/json'
     * --data '{ "message": "string", "props": {} }'
     */
    public Post patchPost(String postId, PatchPostRequest request) {
        String url = baseUrl + "/posts/" + postId + "/patch";
        HttpHeaders headers = createHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<PatchPostRequest> entity = new HttpEntity<>(request, headers);

        ResponseEntity<Post> response = restTemplate.exchange(
                url,
                HttpMethod.PUT,
                entity,
                Post.class
        );
        return response.getBody();
    }

    /**
     * Get Post
     * curl --request GET
     * --url http://localhost:8065/api/v4/posts/{post_id}
     * --header 'Authorization: Bearer 123'
     */
    public Post getPost(String postId) {
        String url = baseUrl + "/posts/" + postId;
        HttpEntity<Void> entity = new HttpEntity<>(createHeaders());

        ResponseEntity<Post> response = restTemplate.exchange(
                url,
                HttpMethod.GET,
                entity,
                Post.class
        );
        return response.getBody();
    }

    /**
     * Get Posts for Channel
     * curl --request GET
     * --url 'http://localhost:8065/api/v4/channels/{channel_id}/posts?since=1700000000000'
     * --header 'Authorization: Bearer 123'
     */
    public PostList getPostsForChannel(String channelId, long sinceMillis) {
        String url = baseUrl + "/channels/" + channelId + "/posts?since=" + sinceMillis;
        HttpEntity<Void> entity = new HttpEntity<>(createHeaders());

        ResponseEntity<PostList> response = restTemplate.exchange(
                url,
                HttpMethod.GET,
                entity,
                PostList.class
        );
        return response.getBody();
    }

    /**
     * Open Dialog
     * curl --request POST
     * --url http://localhost:8065/api/v4/actions/dialogs/open
     * --header 'Authorization: Bearer 123'
     * --header 'Content-Type: application/json'
     * --data '{ "trigger_id": "string", "url": "string", "dialog": { "callback_id": "string", "title": "string", "elements": [] } }'
     */
    public void openDialog(OpenDialogRequest request) {
        String url = baseUrl + "/actions/dialogs/open";
        HttpHeaders headers = createHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<OpenDialogRequest> entity = new HttpEntity<>(request, headers);

        ResponseEntity<Void> response = restTemplate.exchange(
                url,
                HttpMethod.POST,
                entity,
                Void.class
        );
        log.debug("Dialog opened for trigger {}: {}", request.getTrigger_id(), response.getStatusCode());
    }
}
