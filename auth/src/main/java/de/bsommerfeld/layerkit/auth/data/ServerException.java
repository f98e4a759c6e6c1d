package de.bsommerfeld.layerkit.auth.data;

/**
 * Raised by a remote data source when the API answers with a non-success
 * status. The message is the API's own error text when it sent one.
 */
public class ServerException extends RuntimeException {

    private final int statusCode;

    public ServerException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
