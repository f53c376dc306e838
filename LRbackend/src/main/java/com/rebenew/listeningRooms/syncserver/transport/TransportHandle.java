package com.rebenew.listeningRooms.syncserver.transport;

import java.io.IOException;

/**
 * Frontera con el transporte: lo único que el núcleo sabe hacer con una conexión física.
 * Un {@link IOException} en {@link #send(String)} se considera un fallo transitorio.
 */
public interface TransportHandle {

    String getId();

    boolean isOpen();

    void send(String payload) throws IOException;

    void close(CloseReason reason);
}
