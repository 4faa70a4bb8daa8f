package io.polarion.error;

import java.util.List;

public final class ApiErrors {
    private ApiErrors() {
    }

    /**
     * Default retry predicate: 429 and 5xx responses and network failures are retried. Other
     * client errors, decode failures and anything else are not.
     */
    public static boolean isRetryable(Throwable error) {
        ApiException api = findApiException(error);
        if (api != null) {
            int status = api.statusCode();
            if (status >= 400 && status < 500) {
                return status == 429;
            }
            return status >= 500;
        }
        Throwable current = error;
        while (current != null) {
            if (current instanceof TransportException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }

    public static boolean isNotFound(Throwable error) {
        ApiException api = findApiException(error);
        return api != null && api.statusCode() == 404;
    }

    public static boolean isValidation(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ValidationException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    public static List<ErrorDetail> details(Throwable error) {
        ApiException api = findApiException(error);
        return api == null ? List.of() : api.details();
    }

    public static String detailedMessage(Throwable error) {
        ApiException api = findApiException(error);
        if (api != null) {
            return api.detailedMessage();
        }
        return error == null ? "" : String.valueOf(error.getMessage());
    }

    public static ApiException findApiException(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ApiException) {
                return (ApiException) current;
            }
            if (current.getCause() == current) {
                return null;
            }
            current = current.getCause();
        }
        return null;
    }
}
