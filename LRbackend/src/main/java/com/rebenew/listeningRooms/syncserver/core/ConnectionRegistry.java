package com.rebenew.listeningRooms.syncserver.core;

import com.rebenew.listeningRooms.syncserver.auth.TokenValidator;
import com.rebenew.listeningRooms.syncserver.exception.AuthException;
import com.rebenew.listeningRooms.syncserver.exception.ConnectionNotFoundException;
import com.rebenew.listeningRooms.syncserver.model.AuthPrincipal;
import com.rebenew.listeningRooms.syncserver.model.ConnectionStatistics;
import com.rebenew.listeningRooms.syncserver.transport.CloseReason;
import com.rebenew.listeningRooms.syncserver.transport.TransportHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Directorio de conexiones vivas: identidad, sala actual y última actividad.
 *
 * <p>Los tres índices (por conexión, por usuario y por sala) se modifican juntos bajo un único
 * lock de escritura, así nunca se observan desincronizados. Las consultas devuelven copias.
 * La validación del token y el cierre de transportes ocurren siempre fuera del lock.
 */
public class ConnectionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    // ============================
    // ESTADO PRINCIPAL
    // ============================
    private final Map<String, Connection> connections = new HashMap<>();
    private final Map<String, String> connectionByUser = new HashMap<>();
    private final Map<String, Set<String>> connectionsByRoom = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private final TokenValidator tokenValidator;
    private final ExecutorService authExecutor;
    private final Duration authTimeout;
    private final Clock clock;

    public ConnectionRegistry(TokenValidator tokenValidator, ExecutorService authExecutor,
            Duration authTimeout, Clock clock) {
        this.tokenValidator = tokenValidator;
        this.authExecutor = authExecutor;
        this.authTimeout = authTimeout;
        this.clock = clock;
        logger.info("ConnectionRegistry inicializado (authTimeout={})", authTimeout);
    }

    // ====================
    // REGISTRO
    // ====================
    public String register(TransportHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle no puede ser nulo");
        }
        if (shuttingDown.get()) {
            throw new IllegalStateException("El registro está cerrándose");
        }
        String connectionId = UUID.randomUUID().toString();
        Connection connection = new Connection(connectionId, handle, clock.instant());
        lock.writeLock().lock();
        try {
            connections.put(connectionId, connection);
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("🔌 Conexión registrada: {} (transporte {})", connectionId, handle.getId());
        return connectionId;
    }

    // ====================
    // AUTENTICACIÓN
    // ====================

    /**
     * Valida el token y asocia el usuario a la conexión. Si el usuario ya tenía otra conexión
     * viva, esa conexión queda reemplazada y se cierra; la nueva toma su sala si aún no tenía una. Ante un token inválido o un validador
     * que no responde a tiempo la conexión se elimina y se cierra.
     */
    public AuthPrincipal authenticate(String connectionId, String token) {
        Connection connection = find(connectionId)
                .orElseThrow(() -> new ConnectionNotFoundException(connectionId));

        AuthPrincipal principal;
        try {
            principal = validateWithTimeout(token);
        } catch (AuthException e) {
            reject(connection, e.getMessage());
            throw e;
        }

        Connection superseded = null;
        lock.writeLock().lock();
        try {
            if (connections.get(connectionId) != connection) {
                throw new ConnectionNotFoundException(connectionId);
            }
            String previousUser = connection.getUserId();
            if (previousUser != null && !previousUser.equals(principal.userId())) {
                connectionByUser.remove(previousUser, connectionId);
            }
            connection.bind(principal);
            connection.touch(clock.instant());
            String previousId = connectionByUser.put(principal.userId(), connectionId);
            if (previousId != null && !previousId.equals(connectionId)) {
                superseded = connections.get(previousId);
                if (superseded != null) {
                    String inheritedRoom = superseded.getRoomId();
                    removeFromIndexes(superseded);
                    // la conexión nueva hereda la sala para seguir recibiendo sus eventos
                    if (inheritedRoom != null && connection.getRoomId() == null) {
                        connection.attachRoom(inheritedRoom);
                        connectionsByRoom.computeIfAbsent(inheritedRoom, k -> new HashSet<>()).add(connectionId);
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (superseded != null) {
            logger.info("🔁 Conexión {} de {} reemplazada por {}",
                    superseded.getConnectionId(), principal.userId(), connectionId);
            superseded.getHandle().close(CloseReason.SUPERSEDED);
        }
        logger.info("✅ Conexión {} autenticada como {}", connectionId, principal.userId());
        return principal;
    }

    private AuthPrincipal validateWithTimeout(String token) {
        Future<AuthPrincipal> future = authExecutor.submit(() -> tokenValidator.validateToken(token));
        try {
            AuthPrincipal principal = future.get(authTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (principal == null) {
                throw new AuthException("El validador no devolvió identidad");
            }
            return principal;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AuthException("Validación de token excedió " + authTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AuthException) {
                throw (AuthException) cause;
            }
            throw new AuthException("Error validando token: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AuthException("Validación de token interrumpida", e);
        }
    }

    private void reject(Connection connection, String reason) {
        lock.writeLock().lock();
        try {
            if (connections.get(connection.getConnectionId()) == connection) {
                removeFromIndexes(connection);
            }
        } finally {
            lock.writeLock().unlock();
        }
        logger.warn("🔒 Autenticación rechazada para {}: {}", connection.getConnectionId(), reason);
        connection.getHandle().close(CloseReason.AUTH_FAILED);
    }

    // ====================
    // SALAS
    // ====================

    // Asocia la conexión a una sala; si estaba en otra, la abandona primero
    public void joinRoom(String connectionId, String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("roomId no puede ser nulo o vacío");
        }
        lock.writeLock().lock();
        try {
            Connection connection = connections.get(connectionId);
            if (connection == null) {
                throw new ConnectionNotFoundException(connectionId);
            }
            if (!connection.isAuthenticated()) {
                throw new AuthException("La conexión no está autenticada");
            }
            detachFromRoom(connection);
            connection.attachRoom(roomId);
            connectionsByRoom.computeIfAbsent(roomId, k -> new HashSet<>()).add(connectionId);
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("🚪 Conexión {} asociada a sala {}", connectionId, roomId);
    }

    // Devuelve la sala que se abandonó; vacío si no estaba en ninguna
    public Optional<String> leaveRoom(String connectionId) {
        lock.writeLock().lock();
        try {
            Connection connection = connections.get(connectionId);
            if (connection == null) {
                throw new ConnectionNotFoundException(connectionId);
            }
            return Optional.ofNullable(detachFromRoom(connection));
        } finally {
            lock.writeLock().unlock();
        }
    }

    // Desasocia todas las conexiones de una sala destruida
    public int clearRoom(String roomId) {
        lock.writeLock().lock();
        try {
            Set<String> ids = connectionsByRoom.remove(roomId);
            if (ids == null)
                return 0;
            for (String id : ids) {
                Connection connection = connections.get(id);
                if (connection != null) {
                    connection.attachRoom(null);
                }
            }
            return ids.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ====================
    // CONSULTAS
    // ====================
    public Set<String> connectionsFor(String roomId) {
        lock.readLock().lock();
        try {
            Set<String> ids = connectionsByRoom.get(roomId);
            return ids != null ? Set.copyOf(ids) : Set.of();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<String> connectionFor(String userId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(connectionByUser.get(userId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> allConnections() {
        lock.readLock().lock();
        try {
            return Set.copyOf(connections.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Connection> find(String connectionId) {
        if (connectionId == null)
            return Optional.empty();
        lock.readLock().lock();
        try {
            return Optional.ofNullable(connections.get(connectionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public void touch(String connectionId) {
        find(connectionId).ifPresent(c -> c.touch(clock.instant()));
    }

    // ====================
    // BAJAS Y LIMPIEZA
    // ====================

    // Elimina la conexión de todos los índices. El transporte ya está cerrado o lo cierra quien llama.
    public Optional<Connection> unregister(String connectionId) {
        if (connectionId == null)
            return Optional.empty();
        lock.writeLock().lock();
        try {
            Connection connection = connections.get(connectionId);
            if (connection == null)
                return Optional.empty();
            removeFromIndexes(connection);
            logger.debug("🔌 Conexión eliminada: {}", connection);
            return Optional.of(connection);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Elimina y cierra las conexiones sin actividad durante más de {@code timeout}.
     * Las conexiones devueltas conservan usuario y sala para que quien llama propague la salida.
     */
    public List<Connection> sweepStale(Duration timeout) {
        Instant cutoff = clock.instant().minus(timeout);
        List<Connection> removed = removeMatching(c -> c.getLastActivityAt().isBefore(cutoff));
        for (Connection connection : removed) {
            connection.getHandle().close(CloseReason.STALE);
        }
        if (!removed.isEmpty()) {
            logger.info("🧹 {} conexiones inactivas eliminadas", removed.size());
        }
        return removed;
    }

    // Cierra las conexiones que no se autenticaron dentro del periodo de gracia
    public List<Connection> reapUnauthenticated(Duration grace) {
        Instant cutoff = clock.instant().minus(grace);
        List<Connection> removed = removeMatching(c -> !c.isAuthenticated() && c.getOpenedAt().isBefore(cutoff));
        for (Connection connection : removed) {
            connection.getHandle().close(CloseReason.AUTH_FAILED);
        }
        if (!removed.isEmpty()) {
            logger.info("🔒 {} conexiones sin autenticar cerradas", removed.size());
        }
        return removed;
    }

    private List<Connection> removeMatching(Predicate<Connection> condition) {
        List<Connection> removed = new ArrayList<>();
        lock.writeLock().lock();
        try {
            for (Connection connection : new ArrayList<>(connections.values())) {
                if (condition.test(connection)) {
                    removeFromIndexes(connection);
                    removed.add(connection);
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return removed;
    }

    // Requiere el lock de escritura
    private void removeFromIndexes(Connection connection) {
        String connectionId = connection.getConnectionId();
        connections.remove(connectionId);
        String userId = connection.getUserId();
        if (userId != null) {
            connectionByUser.remove(userId, connectionId);
        }
        String roomId = connection.getRoomId();
        if (roomId != null) {
            removeFromRoomIndex(roomId, connectionId);
        }
    }

    // Requiere el lock de escritura. La conexión olvida su sala; devuelve la anterior.
    private String detachFromRoom(Connection connection) {
        String roomId = connection.getRoomId();
        if (roomId == null)
            return null;
        removeFromRoomIndex(roomId, connection.getConnectionId());
        connection.attachRoom(null);
        return roomId;
    }

    private void removeFromRoomIndex(String roomId, String connectionId) {
        Set<String> ids = connectionsByRoom.get(roomId);
        if (ids != null) {
            ids.remove(connectionId);
            if (ids.isEmpty()) {
                connectionsByRoom.remove(roomId);
            }
        }
    }

    // ====================
    // ESTADÍSTICAS
    // ====================
    public ConnectionStatistics getStatistics() {
        lock.readLock().lock();
        try {
            int authenticated = (int) connections.values().stream().filter(Connection::isAuthenticated).count();
            Map<String, Integer> byRoom = new TreeMap<>();
            connectionsByRoom.forEach((roomId, ids) -> byRoom.put(roomId, ids.size()));
            return new ConnectionStatistics(connections.size(), authenticated,
                    new TreeSet<>(connectionByUser.keySet()), byRoom);
        } finally {
            lock.readLock().unlock();
        }
    }

    // ====================
    // SHUTDOWN
    // ====================
    public void shutdown() {
        if (!shuttingDown.compareAndSet(false, true))
            return;
        List<Connection> all;
        lock.writeLock().lock();
        try {
            all = new ArrayList<>(connections.values());
            connections.clear();
            connectionByUser.clear();
            connectionsByRoom.clear();
        } finally {
            lock.writeLock().unlock();
        }
        for (Connection connection : all) {
            try {
                connection.getHandle().close(CloseReason.SHUTDOWN);
            } catch (RuntimeException e) {
                logger.warn("Error cerrando conexión {} durante shutdown: {}", connection.getConnectionId(), e.getMessage());
            }
        }
        logger.info("🛑 ConnectionRegistry detenido ({} conexiones cerradas)", all.size());
    }
}
