/*
 * FTPClient.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of ftpwire, the gumdrop FTP client protocol library.
 * For more information please visit https://www.nongnu.org/gumdrop/
 *
 * ftpwire is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ftpwire is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with ftpwire.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.ftpwire.client;

import java.io.IOException;
import java.text.MessageFormat;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.bluezoo.ftpwire.client.listing.FTPListingEntry;

/**
 * FTP client command layer.
 *
 * <p>This class turns client intent into command lines, sends them through
 * an {@link FTPTransport} and interprets the replies with an
 * {@link FTPProtocol}. It does not manage sockets, log in or copy file
 * contents: those belong to the transport and to the caller.
 *
 * <p>Every command method runs through an {@link FTPCommandInvoker}, so
 * each command is logged when issued and each failure is logged with the
 * command name before it propagates. A reply with an unexpected code
 * raises an {@link FTPException} carrying that reply.
 *
 * <p>The initial connection mode is read from the
 * <code>ftpwire.connection.mode</code> system property
 * (<code>PASV</code> or <code>PORT</code>, default <code>PASV</code>).
 *
 * <p>Instances hold per-session state and are not thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class FTPClient {

    private static final Logger LOGGER = Logger.getLogger(FTPClient.class.getName());

    /**
     * System property naming the default connection mode command.
     */
    public static final String CONNECTION_MODE_PROPERTY = "ftpwire.connection.mode";

    private static final Pattern QUOTED_PATH = Pattern.compile("\"([^\"]*)\"");
    private static final DateTimeFormatter MDTM_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final FTPTransport transport;
    private final FTPProtocol protocol;
    private final FTPCommandInvoker invoker;

    private ConnectionMode connectionMode;
    private TransferMode transferMode;

    /**
     * Creates a client using the standard protocol interpretation.
     *
     * @param transport the connection to the server
     */
    public FTPClient(FTPTransport transport) {
        this(transport, new DefaultFTPProtocol());
    }

    /**
     * @param transport the connection to the server
     * @param protocol the reply and listing interpretation
     */
    public FTPClient(FTPTransport transport, FTPProtocol protocol) {
        this(transport, protocol, new FTPCommandInvoker(LOGGER));
    }

    /**
     * @param transport the connection to the server
     * @param protocol the reply and listing interpretation
     * @param invoker the invoker wrapping each command
     * @throws IllegalArgumentException if the connection mode property is
     * not PASV or PORT
     */
    public FTPClient(FTPTransport transport, FTPProtocol protocol, FTPCommandInvoker invoker) {
        this.transport = transport;
        this.protocol = protocol;
        this.invoker = invoker;
        String mode = System.getProperty(CONNECTION_MODE_PROPERTY, ConnectionMode.PASSIVE.getCommand());
        this.connectionMode = ConnectionMode.fromCommand(mode.trim());
    }

    /**
     * @return the protocol interpretation used by this client
     */
    public FTPProtocol getProtocol() {
        return protocol;
    }

    // -- Modes --

    /**
     * Sets how subsequent data connections are established.
     * No command is sent until a data connection is needed.
     *
     * @param mode the connection mode
     */
    public void setConnectionMode(ConnectionMode mode) {
        connectionMode = mode;
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = FTPReply.L10N.getString("client.connection_mode");
            LOGGER.fine(MessageFormat.format(message, mode));
        }
    }

    public ConnectionMode getConnectionMode() {
        return connectionMode;
    }

    /**
     * Sends TYPE to select the transfer mode. Nothing is sent if the mode
     * is already selected.
     *
     * @param mode the transfer mode
     * @throws IOException if the server refuses the mode or the transport fails
     */
    public void setTransferMode(TransferMode mode) throws IOException {
        invoker.invoke("type", new Object[] { mode }, () -> {
            if (mode == transferMode) {
                return null;
            }
            FTPReply reply = exchange("TYPE " + mode.getCode());
            expect(reply, "TYPE", FTPReply.COMMAND_OK);
            transferMode = mode;
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = FTPReply.L10N.getString("client.transfer_mode");
                LOGGER.fine(MessageFormat.format(message, mode));
            }
            return null;
        });
    }

    /**
     * @return the transfer mode last selected, or null if none was
     */
    public TransferMode getTransferMode() {
        return transferMode;
    }

    /**
     * Chooses the transfer mode for a file.
     *
     * @param filename the local or remote file name
     * @return BINARY for binary files, ASCII for text files
     */
    public TransferMode transferModeFor(String filename) {
        return protocol.isBinary(filename) ? TransferMode.BINARY : TransferMode.ASCII;
    }

    // -- Data connection negotiation --

    /**
     * Sends PASV and returns the address the server listens on.
     *
     * @return the server data address
     * @throws IOException if the reply is not 227 or has no address
     */
    public FTPDataAddress pasv() throws IOException {
        return invoker.invoke("pasv", new Object[0], this::doPasv);
    }

    /**
     * Sends PORT to announce the address this client listens on.
     *
     * @param host dotted-quad local address
     * @param port local port
     * @throws IOException if the reply is not 200
     */
    public void port(String host, int port) throws IOException {
        invoker.invoke("port", new Object[] { host, port }, () -> {
            doPort(host, port);
            return null;
        });
    }

    /**
     * Negotiates a data connection in the current connection mode.
     *
     * @return in passive mode the server address, in active mode the local
     * address announced with PORT
     * @throws IOException if negotiation fails
     */
    public FTPDataAddress openDataAddress() throws IOException {
        String name = connectionMode.getCommand();
        return invoker.invoke(name, new Object[0], this::negotiateDataAddress);
    }

    // Not wrapped: callers already run inside the invoker.
    private FTPDataAddress negotiateDataAddress() throws IOException {
        FTPDataAddress address;
        if (connectionMode == ConnectionMode.PASSIVE) {
            address = doPasv();
        } else {
            int localPort = transport.listenForData();
            String host = transport.getLocalAddress().getAddress().getHostAddress();
            doPort(host, localPort);
            address = new FTPDataAddress(host, localPort);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = FTPReply.L10N.getString("client.data_address");
            LOGGER.fine(MessageFormat.format(message, address, connectionMode));
        }
        return address;
    }

    private FTPDataAddress doPasv() throws IOException {
        FTPReply reply = exchange("PASV");
        expect(reply, "PASV", FTPReply.PASSIVE_MODE);
        return protocol.parsePassiveAddress(reply.getMessage());
    }

    private void doPort(String host, int port) throws IOException {
        FTPReply reply = exchange("PORT " + protocol.buildActiveCommandArgument(host, port));
        expect(reply, "PORT", FTPReply.COMMAND_OK);
    }

    // -- Listings --

    /**
     * Lists a directory with LIST.
     *
     * @param path the directory, or null for the working directory
     * @return the entries; lines not in Unix format have type UNKNOWN
     * @throws IOException if a reply is unexpected or the transport fails
     */
    public List<FTPListingEntry> list(String path) throws IOException {
        return invoker.invoke("list", new Object[] { path }, () ->
                protocol.parseTextListing(readListing("LIST", path, false)));
    }

    /**
     * Lists a directory with MLSD.
     *
     * @param path the directory, or null for the working directory
     * @return the entries; malformed lines are skipped
     * @throws IOException if a reply is unexpected or the transport fails
     */
    public List<FTPListingEntry> mlsd(String path) throws IOException {
        return invoker.invoke("mlsd", new Object[] { path }, () ->
                protocol.parseStructuredListing(readListing("MLSD", path, true)));
    }

    private List<String> readListing(String command, String path, boolean completeEarly)
            throws IOException {
        FTPDataAddress address = negotiateDataAddress();
        String line = (path == null || path.isEmpty()) ? command : command + " " + path;
        FTPReply reply = exchange(line);
        if (completeEarly) {
            expect(reply, command, FTPReply.DATA_CONNECTION_ALREADY_OPEN,
                   FTPReply.FILE_STATUS_OK, FTPReply.TRANSFER_COMPLETE);
        } else {
            expect(reply, command, FTPReply.DATA_CONNECTION_ALREADY_OPEN,
                   FTPReply.FILE_STATUS_OK);
        }
        List<String> lines = transport.readDataLines(address, connectionMode);
        if (reply.isPositivePreliminary()) {
            FTPReply completion = readReply();
            expect(completion, command, FTPReply.TRANSFER_COMPLETE, FTPReply.FILE_ACTION_OK);
        }
        return lines;
    }

    // -- Directory commands --

    /**
     * Sends PWD.
     *
     * @return the quoted directory of the reply, or the whole reply
     * message if it has no quoted part
     * @throws IOException if the reply is not 257
     */
    public String pwd() throws IOException {
        return invoker.invoke("pwd", new Object[0], () -> {
            FTPReply reply = exchange("PWD");
            expect(reply, "PWD", FTPReply.PATH_CREATED);
            String path = quotedPath(reply);
            return (path != null) ? path : reply.getMessage();
        });
    }

    /**
     * Sends CWD.
     *
     * @param directory the new working directory
     * @throws IOException if the reply is not 2xx
     */
    public void cwd(String directory) throws IOException {
        invoker.invoke("cwd", new Object[] { directory }, () -> {
            expectCompletion(exchange("CWD " + directory), "CWD");
            return null;
        });
    }

    /**
     * Sends CDUP.
     *
     * @throws IOException if the reply is not 2xx
     */
    public void cdup() throws IOException {
        invoker.invoke("cdup", new Object[0], () -> {
            expectCompletion(exchange("CDUP"), "CDUP");
            return null;
        });
    }

    /**
     * Sends MKD.
     *
     * @param directory the directory to create
     * @return the created path as quoted by the server, or the argument
     * @throws IOException if the reply is not 257
     */
    public String mkd(String directory) throws IOException {
        return invoker.invoke("mkd", new Object[] { directory }, () -> {
            FTPReply reply = exchange("MKD " + directory);
            expect(reply, "MKD", FTPReply.PATH_CREATED);
            String path = quotedPath(reply);
            return (path != null) ? path : directory;
        });
    }

    /**
     * Sends RMD.
     *
     * @param directory the directory to remove
     * @throws IOException if the reply is not 2xx
     */
    public void rmd(String directory) throws IOException {
        invoker.invoke("rmd", new Object[] { directory }, () -> {
            expectCompletion(exchange("RMD " + directory), "RMD");
            return null;
        });
    }

    // -- File commands --

    /**
     * Sends DELE.
     *
     * @param path the file to delete
     * @throws IOException if the reply is not 2xx
     */
    public void dele(String path) throws IOException {
        invoker.invoke("dele", new Object[] { path }, () -> {
            expectCompletion(exchange("DELE " + path), "DELE");
            return null;
        });
    }

    /**
     * Renames a file with RNFR and RNTO.
     *
     * @param from the existing path
     * @param to the new path
     * @throws IOException if RNFR is not answered with 350 or RNTO with 2xx
     */
    public void rename(String from, String to) throws IOException {
        invoker.invoke("rename", new Object[] { from, to }, () -> {
            expect(exchange("RNFR " + from), "RNFR", FTPReply.FILE_ACTION_PENDING);
            expectCompletion(exchange("RNTO " + to), "RNTO");
            return null;
        });
    }

    /**
     * Sends SIZE.
     *
     * @param path the file
     * @return the size in bytes
     * @throws IOException if the reply is not 2xx or has no number
     */
    public long size(String path) throws IOException {
        return invoker.invoke("size", new Object[] { path }, () -> {
            FTPReply reply = exchange("SIZE " + path);
            expectCompletion(reply, "SIZE");
            try {
                return Long.parseLong(firstToken(reply));
            } catch (NumberFormatException e) {
                String message = FTPReply.L10N.getString("err.size_format");
                throw new FTPException(MessageFormat.format(message, reply), e);
            }
        });
    }

    /**
     * Sends MDTM.
     *
     * @param path the file
     * @return the modification time, interpreted as UTC
     * @throws IOException if the reply is not 2xx or has no timestamp
     */
    public Instant mdtm(String path) throws IOException {
        return invoker.invoke("mdtm", new Object[] { path }, () -> {
            FTPReply reply = exchange("MDTM " + path);
            expectCompletion(reply, "MDTM");
            String token = firstToken(reply);
            // fractional seconds are ignored
            if (token.length() > 14 && token.charAt(14) == '.') {
                token = token.substring(0, 14);
            }
            try {
                return LocalDateTime.parse(token, MDTM_FORMAT).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e) {
                String message = FTPReply.L10N.getString("err.mdtm_format");
                throw new FTPException(MessageFormat.format(message, reply), e);
            }
        });
    }

    /**
     * Sends NOOP.
     *
     * @throws IOException if the reply is not 2xx
     */
    public void noop() throws IOException {
        invoker.invoke("noop", new Object[0], () -> {
            expectCompletion(exchange("NOOP"), "NOOP");
            return null;
        });
    }

    /**
     * Sends an arbitrary command line and returns the reply, whatever its
     * code.
     *
     * @param command the command line, e.g. "SITE CHMOD 644 file.txt"
     * @return the reply
     * @throws IOException if the transport fails
     */
    public FTPReply quote(String command) throws IOException {
        return invoker.invoke("quote", new Object[] { command }, () -> exchange(command));
    }

    // -- Internals --

    private FTPReply exchange(String command) throws IOException {
        transport.sendCommand(command);
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = FTPReply.L10N.getString("client.sent");
            LOGGER.fine(MessageFormat.format(message, command));
        }
        return readReply();
    }

    private FTPReply readReply() throws IOException {
        String line = transport.readReply();
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = FTPReply.L10N.getString("client.received");
            LOGGER.fine(MessageFormat.format(message, line));
        }
        return protocol.parseReply(line);
    }

    private static void expect(FTPReply reply, String command, int... codes) throws FTPException {
        for (int code : codes) {
            if (reply.getCode() == code) {
                return;
            }
        }
        String message = FTPReply.L10N.getString("err.unexpected_reply");
        throw new FTPException(MessageFormat.format(message, command), reply);
    }

    private static void expectCompletion(FTPReply reply, String command) throws FTPException {
        if (!reply.isPositiveCompletion()) {
            String message = FTPReply.L10N.getString("err.unexpected_reply");
            throw new FTPException(MessageFormat.format(message, command), reply);
        }
    }

    private static String quotedPath(FTPReply reply) {
        Matcher m = QUOTED_PATH.matcher(reply.getMessage());
        return m.find() ? m.group(1) : null;
    }

    private static String firstToken(FTPReply reply) {
        String message = reply.getMessage();
        int sp = message.indexOf(' ');
        return (sp < 0) ? message : message.substring(0, sp);
    }

}
