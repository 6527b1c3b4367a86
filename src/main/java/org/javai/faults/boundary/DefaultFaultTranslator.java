package org.javai.faults.boundary;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.javai.faults.Fault;

import java.io.FileNotFoundException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.util.concurrent.TimeoutException;

/**
 * Default translation for common JDK and Jackson exceptions.
 * Anything it does not recognise becomes an {@link org.javai.faults.ErrorKind#INTERNAL} fault.
 */
public class DefaultFaultTranslator implements FaultTranslator {

    @Override
    public Fault translate(String operation, Exception e) {
        String detail = detailOf(e);

        if (e instanceof SocketTimeoutException || e instanceof HttpTimeoutException) {
            return Fault.network("Timeout: " + detail);
        }

        if (e instanceof ConnectException) {
            return Fault.connection(detail);
        }

        if (e instanceof UnknownHostException) {
            return Fault.network("Unknown host: " + detail);
        }

        if (e instanceof TimeoutException) {
            return Fault.network("Timeout: " + detail);
        }

        if (e instanceof SQLException sql) {
            // SQLState class 08: connection exception
            String sqlState = sql.getSQLState();
            if (sqlState != null && sqlState.startsWith("08")) {
                return Fault.connection(detail);
            }
            return Fault.database(operation, detail);
        }

        if (e instanceof NoSuchFileException noSuchFile) {
            return Fault.notFound("file", noSuchFile.getFile());
        }

        if (e instanceof FileNotFoundException) {
            return Fault.notFound("file", detail);
        }

        if (e instanceof JsonProcessingException json) {
            return Fault.parsing(json.getOriginalMessage() != null ? json.getOriginalMessage() : detail);
        }

        return Fault.internal(detail);
    }

    private static String detailOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
