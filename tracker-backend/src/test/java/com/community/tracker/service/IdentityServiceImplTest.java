package com.community.tracker.service;

import com.community.tracker.client.ExternalProfile;
import com.community.tracker.client.ProfileClient;
import com.community.tracker.dto.PersonDTO;
import com.community.tracker.dto.ProfileDTO;
import com.community.tracker.entity.Person;
import com.community.tracker.exception.ErrorKind;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.repository.PersonRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdentityServiceImplTest {

    @Mock
    private PersonRepository personRepository;

    @Mock
    private ProfileClient profileClient;

    private IdentityServiceImpl identityService;

    @BeforeEach
    void setUp() {
        identityService = new IdentityServiceImpl(personRepository, profileClient,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void registerPersonIsIdempotent() {
        Person existing = person(1L, null);
        when(personRepository.findByExternalUserId(9001L)).thenReturn(Optional.of(existing));

        PersonDTO result = identityService.registerPerson(9001L, "kstorm");

        assertEquals(1L, result.getPersonId());
        verify(personRepository, never()).save(any());
    }

    @Test
    void linkProfileVerifiesHandleOnce() {
        Person person = person(1L, null);
        when(personRepository.findById(1L)).thenReturn(Optional.of(person));
        when(personRepository.findByExternalHandleIgnoreCase("kstorm")).thenReturn(Optional.empty());
        when(profileClient.fetchProfile("kstorm")).thenReturn(Optional.of(new ExternalProfile(42L, "kstorm", null, null)));
        when(personRepository.save(any(Person.class))).thenAnswer(inv -> inv.getArgument(0));

        PersonDTO result = identityService.linkProfile(1L, "kstorm");

        assertEquals("kstorm", result.getExternalHandle());
        assertNotNull(result.getLinkedAt());
        assertEquals(42L, person.getExternalProfileId());
        verify(profileClient).fetchProfile("kstorm");
    }

    @Test
    void linkUnknownHandleIsHandleNotFound() {
        when(personRepository.findById(1L)).thenReturn(Optional.of(person(1L, null)));
        when(personRepository.findByExternalHandleIgnoreCase("ghost")).thenReturn(Optional.empty());
        when(profileClient.fetchProfile("ghost")).thenReturn(Optional.empty());

        TrackerException ex = assertThrows(TrackerException.class, () -> identityService.linkProfile(1L, "ghost"));

        assertEquals(ErrorKind.HANDLE_NOT_FOUND, ex.getKind());
        verify(personRepository, never()).save(any());
    }

    @Test
    void linkHandleOfAnotherPersonIsAlreadyLinked() {
        when(personRepository.findById(1L)).thenReturn(Optional.of(person(1L, null)));
        when(personRepository.findByExternalHandleIgnoreCase("kstorm")).thenReturn(Optional.of(person(2L, "kstorm")));

        TrackerException ex = assertThrows(TrackerException.class, () -> identityService.linkProfile(1L, "kstorm"));

        assertEquals(ErrorKind.ALREADY_LINKED, ex.getKind());
        verify(profileClient, never()).fetchProfile(anyString());
    }

    @Test
    void relinkingSameHandleIsAlreadyLinked() {
        when(personRepository.findById(1L)).thenReturn(Optional.of(person(1L, "kstorm")));

        TrackerException ex = assertThrows(TrackerException.class, () -> identityService.linkProfile(1L, "KStorm"));

        assertEquals(ErrorKind.ALREADY_LINKED, ex.getKind());
    }

    @Test
    void upstreamFailurePropagates() {
        when(personRepository.findById(1L)).thenReturn(Optional.of(person(1L, null)));
        when(personRepository.findByExternalHandleIgnoreCase("kstorm")).thenReturn(Optional.empty());
        when(profileClient.fetchProfile("kstorm"))
                .thenThrow(TrackerException.upstreamUnavailable("AniList timed out", new RuntimeException("timeout")));

        TrackerException ex = assertThrows(TrackerException.class, () -> identityService.linkProfile(1L, "kstorm"));

        assertEquals(ErrorKind.UPSTREAM_UNAVAILABLE, ex.getKind());
        verify(personRepository, never()).save(any());
    }

    @Test
    void getProfileOfUnlinkedPersonIsNotLinked() {
        when(personRepository.findById(1L)).thenReturn(Optional.of(person(1L, null)));

        TrackerException ex = assertThrows(TrackerException.class, () -> identityService.getProfile(1L));

        assertEquals(ErrorKind.NOT_LINKED, ex.getKind());
    }

    @Test
    void unlinkClearsHandle() {
        Person person = person(1L, "kstorm");
        when(personRepository.findById(1L)).thenReturn(Optional.of(person));

        identityService.unlinkProfile(1L);

        assertNull(person.getExternalHandle());
        verify(personRepository).save(person);
    }

    @Test
    void getProfileReturnsLinkedHandle() {
        when(personRepository.findById(1L)).thenReturn(Optional.of(person(1L, "kstorm")));

        ProfileDTO profile = identityService.getProfile(1L);

        assertEquals("kstorm", profile.getExternalHandle());
    }

    private Person person(Long personId, String handle) {
        Person person = new Person();
        person.setPersonId(personId);
        person.setExternalUserId(9000L + personId);
        person.setDisplayName("person-" + personId);
        person.setExternalHandle(handle);
        return person;
    }
}
