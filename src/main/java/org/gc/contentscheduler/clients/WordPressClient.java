package org.gc.contentscheduler.clients;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;

import java.net.URI;
import java.util.Map;

/**
 * WordPress REST API. Every call takes the site's base URI explicitly since
 * each publishing site lives on its own host.
 */
@FeignClient(name = "wordpress-integration", url = "${wordpress.default-url:http://localhost}")
public interface WordPressClient {

    @RequestMapping(method = RequestMethod.POST, value = "/wp-json/wp/v2/posts")
    Map<String, Object> createPost(URI siteUri,
                                   @RequestHeader(value = "Authorization", required = true) String authorizationHeader,
                                   @RequestBody Map<String, Object> post);
}
