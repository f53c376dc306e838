package com.rebenew.listeningRooms.syncserver.repository;

import com.rebenew.listeningRooms.syncserver.model.PlaybackState;
import com.rebenew.listeningRooms.syncserver.model.TrackEntry;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Implementación en memoria usada cuando no hay otro repositorio configurado.
 * La cola se devuelve ordenada por votos y luego por orden de llegada.
 */
public class InMemoryRoomRepository implements RoomRepository {

    private final ConcurrentHashMap<String, List<TrackEntry>> queues = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PlaybackState> playbacks = new ConcurrentHashMap<>();

    @Override
    public List<TrackEntry> findQueue(String roomId) {
        return queues.getOrDefault(roomId, List.of()).stream()
                .sorted(Comparator.comparingInt(TrackEntry::voteScore).reversed()
                        .thenComparingLong(TrackEntry::addedAt))
                .collect(Collectors.toList());
    }

    @Override
    public PlaybackState findPlayback(String roomId) {
        return playbacks.getOrDefault(roomId, PlaybackState.idle());
    }

    @Override
    public void saveQueue(String roomId, List<TrackEntry> queue) {
        queues.put(roomId, List.copyOf(queue));
    }

    @Override
    public void savePlayback(String roomId, PlaybackState playback) {
        playbacks.put(roomId, playback);
    }

    @Override
    public void deleteRoom(String roomId) {
        queues.remove(roomId);
        playbacks.remove(roomId);
    }
}
