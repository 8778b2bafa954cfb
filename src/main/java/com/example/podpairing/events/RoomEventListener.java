package com.example.podpairing.events;

/** Receives room events after the session lock has been released. */
@FunctionalInterface
public interface RoomEventListener {

    void onEvent(RoomEvent event);
}
