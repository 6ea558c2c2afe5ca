package ru.panic.orderautomationbot.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import ru.panic.orderautomationbot.exception.MarketplaceApiException;
import ru.panic.orderautomationbot.exception.SupportAuthorizationException;
import ru.panic.orderautomationbot.property.FunPayProperty;

import java.net.URI;
import java.util.List;

/**
 * Files tickets on the support site. The support session is obtained through FunPay's SSO: the golden key
 * yields a JWT redirect, the JWT yields the support PHPSESSID, the ticket form yields the CSRF token.
 */
@Component
@Slf4j
public class FunPaySupportApi {
    // "Order confirmation" ticket category
    private static final String TICKET_FORM_PATH = "/tickets/new/1";
    private static final String TICKET_CREATE_PATH = "/tickets/create/1";

    private final RestTemplate restTemplate;
    private final FunPayHtmlParser funPayHtmlParser;
    private final FunPayProperty funPayProperty;

    public FunPaySupportApi(RestTemplate restTemplate, FunPayHtmlParser funPayHtmlParser, FunPayProperty funPayProperty) {
        this.restTemplate = restTemplate;
        this.funPayHtmlParser = funPayHtmlParser;
        this.funPayProperty = funPayProperty;
    }

    public String openSession() {
        String goldenKey = funPayProperty.getGoldenKey();

        if (goldenKey == null || goldenKey.length() < 20) {
            throw new SupportAuthorizationException("Golden key is missing or malformed");
        }

        HttpHeaders headers = browserHeaders();
        headers.set(HttpHeaders.COOKIE, "golden_key=" + goldenKey);
        headers.set(HttpHeaders.REFERER, funPayProperty.getBaseUrl() + "/");

        ResponseEntity<String> sso = exchange(HttpMethod.GET,
                funPayProperty.getBaseUrl() + "/support/sso?return_to=%2Ftickets%2Fnew", headers, null);

        if (sso.getStatusCode().value() != HttpStatus.FOUND.value()) {
            throw new SupportAuthorizationException("SSO answered " + sso.getStatusCode() + " instead of a redirect");
        }

        URI location = sso.getHeaders().getLocation();
        String jwt = location == null ? null : queryParameter(location.toString(), "jwt");

        if (jwt == null) {
            throw new SupportAuthorizationException("SSO redirect carries no jwt");
        }

        ResponseEntity<String> access = exchange(HttpMethod.GET,
                funPayProperty.getSupportBaseUrl() + "/access/jwt?jwt=" + jwt + "&return_to=%2Ftickets%2Fnew",
                browserHeaders(), null);
        String sessionId = FunPayApi.extractCookie(access.getHeaders(), "PHPSESSID");

        if (sessionId == null) {
            throw new SupportAuthorizationException("Support site set no PHPSESSID, status " + access.getStatusCode());
        }

        log.info("Support session opened");
        return sessionId;
    }

    public String fetchCsrfToken(String sessionId) {
        HttpHeaders headers = browserHeaders();
        headers.set(HttpHeaders.COOKIE, "PHPSESSID=" + sessionId);
        headers.set(HttpHeaders.REFERER, funPayProperty.getSupportBaseUrl() + TICKET_FORM_PATH);

        ResponseEntity<String> form = exchange(HttpMethod.GET, funPayProperty.getSupportBaseUrl() + TICKET_FORM_PATH, headers, null);

        if (!form.getStatusCode().is2xxSuccessful() || form.getBody() == null) {
            throw new SupportAuthorizationException("Ticket form answered " + form.getStatusCode());
        }

        return funPayHtmlParser.parseSupportCsrfToken(form.getBody())
                .orElseThrow(() -> new SupportAuthorizationException("No CSRF token on the ticket form"));
    }

    /**
     * @return the id of the created ticket, empty if the site did not redirect to it
     */
    public String submitTicket(String sessionId, String csrfToken, String sellerUsername, String firstOrderId, String message) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, funPayProperty.getUserAgent());
        headers.set(HttpHeaders.COOKIE, "PHPSESSID=" + sessionId);
        headers.set(HttpHeaders.ORIGIN, funPayProperty.getSupportBaseUrl());
        headers.set(HttpHeaders.REFERER, funPayProperty.getSupportBaseUrl() + TICKET_FORM_PATH);
        headers.set("X-Requested-With", "XMLHttpRequest");
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("ticket[fields][1]", sellerUsername == null ? "" : sellerUsername);
        form.add("ticket[fields][2]", firstOrderId);
        form.add("ticket[fields][3]", "2");
        form.add("ticket[fields][5]", "201");
        form.add("ticket[comment][body_html]", "<p dir=\"auto\">" + message + "</p>");
        form.add("ticket[comment][attachments]", "");
        form.add("ticket[_token]", csrfToken);
        form.add("ticket[submit]", "Отправить");

        ResponseEntity<String> response = exchange(HttpMethod.POST, funPayProperty.getSupportBaseUrl() + TICKET_CREATE_PATH, headers, form);
        HttpStatusCode status = response.getStatusCode();

        if (!status.is2xxSuccessful() && !status.is3xxRedirection()) {
            throw new MarketplaceApiException("Ticket submission answered " + status);
        }

        URI location = response.getHeaders().getLocation();

        return location == null ? "" : ticketIdOf(location.toString());
    }

    static String ticketIdOf(String url) {
        if (!url.contains("/tickets/")) {
            return "";
        }

        String trimmed = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;

        return trimmed.substring(trimmed.lastIndexOf('/') + 1);
    }

    static String queryParameter(String url, String name) {
        int start = url.indexOf(name + "=");

        if (start < 0) {
            return null;
        }

        start += name.length() + 1;
        int end = url.indexOf('&', start);

        return url.substring(start, end < 0 ? url.length() : end);
    }

    private HttpHeaders browserHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, funPayProperty.getUserAgent());
        headers.setAccept(List.of(MediaType.TEXT_HTML, MediaType.APPLICATION_XHTML_XML, MediaType.ALL));
        return headers;
    }

    private ResponseEntity<String> exchange(HttpMethod method, String url, HttpHeaders headers, MultiValueMap<String, String> form) {
        try {
            return restTemplate.exchange(URI.create(url), method, new HttpEntity<>(form, headers), String.class);
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == 401 || e.getStatusCode().value() == 403) {
                throw new SupportAuthorizationException(method + " " + url + " answered " + e.getStatusCode(), e);
            }
            throw new MarketplaceApiException(method + " " + url + " failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new MarketplaceApiException(method + " " + url + " failed: " + e.getMessage(), e);
        }
    }
}
