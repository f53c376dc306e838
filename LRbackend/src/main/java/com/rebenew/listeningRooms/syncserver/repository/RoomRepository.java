package com.rebenew.listeningRooms.syncserver.repository;

import com.rebenew.listeningRooms.syncserver.model.PlaybackState;
import com.rebenew.listeningRooms.syncserver.model.TrackEntry;

import java.util.List;

/**
 * Almacenamiento externo de la cola y del estado de reproducción de cada sala.
 */
public interface RoomRepository {

    List<TrackEntry> findQueue(String roomId);

    PlaybackState findPlayback(String roomId);

    void saveQueue(String roomId, List<TrackEntry> queue);

    void savePlayback(String roomId, PlaybackState playback);

    void deleteRoom(String roomId);
}
