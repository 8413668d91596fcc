package brandai.core.model.auth;

/**
 * Where to send the browser to start the authorization-code flow.
 *
 * @param authorizationUrl the GitHub authorize URL including all query parameters
 * @param state            the CSRF state embedded in the URL
 */
public record AuthorizationRequest(String authorizationUrl, String state) {}
