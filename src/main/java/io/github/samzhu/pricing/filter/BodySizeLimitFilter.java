package io.github.samzhu.pricing.filter;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.pricing.config.PricingProperties;
import io.github.samzhu.pricing.dto.api.ErrorResponse;
import io.github.samzhu.pricing.exception.ErrorCode;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;

/**
 * 拒絕過大的 API 請求 body（413）。
 *
 * <p>只檢查 {@code /v1/} 下的 POST/PUT/PATCH。有 {@code Content-Length} 時直接比較；
 * 沒有時（例如 chunked）先讀取至多 {@code maxBodyBytes + 1} bytes，
 * 未超過上限則以讀到的內容繼續處理。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class BodySizeLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(BodySizeLimitFilter.class);

    private static final Set<String> CHECKED_METHODS = Set.of("POST", "PUT", "PATCH");

    private final long maxBodyBytes;
    private final ObjectMapper objectMapper;

    public BodySizeLimitFilter(PricingProperties properties, ObjectMapper objectMapper) {
        this.maxBodyBytes = properties.api().maxBodyBytes();
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !CHECKED_METHODS.contains(request.getMethod())
            || !request.getRequestURI().startsWith("/v1/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long contentLength = request.getContentLengthLong();
        if (contentLength > maxBodyBytes) {
            reject(request, response, contentLength);
            return;
        }
        if (contentLength >= 0) {
            filterChain.doFilter(request, response);
            return;
        }

        byte[] body = request.getInputStream().readNBytes((int) Math.min(maxBodyBytes + 1, Integer.MAX_VALUE));
        if (body.length > maxBodyBytes) {
            // 未讀完整個 body，回報的長度只代表「至少」這麼多
            reject(request, response, body.length);
            return;
        }
        filterChain.doFilter(new BufferedBodyRequest(request, body), response);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, long contentLength)
            throws IOException {
        log.info("Request body rejected: uri={}, contentLength={}, max={}",
            request.getRequestURI(), contentLength, maxBodyBytes);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("max_body_bytes", maxBodyBytes);
        details.put("content_length", contentLength);

        response.setStatus(HttpStatus.PAYLOAD_TOO_LARGE.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(),
            ErrorResponse.of(ErrorCode.INVALID_REQUEST.name(), "Request body exceeds 1MB limit", details));
    }

    /**
     * 以已讀取的 body 取代原本的輸入串流。
     */
    private static final class BufferedBodyRequest extends HttpServletRequestWrapper {

        private final byte[] body;

        BufferedBodyRequest(HttpServletRequest request, byte[] body) {
            super(request);
            this.body = body;
        }

        @Override
        public ServletInputStream getInputStream() {
            ByteArrayInputStream in = new ByteArrayInputStream(body);
            return new ServletInputStream() {
                @Override
                public int read() {
                    return in.read();
                }

                @Override
                public int read(byte[] buffer, int offset, int length) {
                    return in.read(buffer, offset, length);
                }

                @Override
                public boolean isFinished() {
                    return in.available() == 0;
                }

                @Override
                public boolean isReady() {
                    return true;
                }

                @Override
                public void setReadListener(ReadListener listener) {
                    throw new UnsupportedOperationException("Async reads are not supported");
                }
            };
        }

        @Override
        public BufferedReader getReader() {
            Charset charset = getCharacterEncoding() != null
                ? Charset.forName(getCharacterEncoding())
                : StandardCharsets.UTF_8;
            return new BufferedReader(new InputStreamReader(new ByteArrayInputStream(body), charset));
        }

        @Override
        public int getContentLength() {
            return body.length;
        }

        @Override
        public long getContentLengthLong() {
            return body.length;
        }
    }
}
