package org.commissaire.http.pojos;

/**
 * HTTP section of a Function URL request context ({@code requestContext.http}).
 * The method and path here are the ones routing works on.
 */
public class RequestContextHttp {
    private String method;
    private String path;
    private String sourceIp;

    public RequestContextHttp() {
    }

    public RequestContextHttp(String method, String path) {
        this.method = method;
        this.path = path;
    }

    public String getMethod() {
        return method;
    }

    public void setMethod(String method) {
        this.method = method;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public void setSourceIp(String sourceIp) {
        this.sourceIp = sourceIp;
    }
}
