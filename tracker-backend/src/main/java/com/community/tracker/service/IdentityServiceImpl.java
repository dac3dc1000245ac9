package com.community.tracker.service;

import com.community.tracker.client.ExternalProfile;
import com.community.tracker.client.ProfileClient;
import com.community.tracker.dto.PersonDTO;
import com.community.tracker.dto.ProfileDTO;
import com.community.tracker.entity.Person;
import com.community.tracker.exception.TrackerException;
import com.community.tracker.repository.PersonRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Service
@Transactional
public class IdentityServiceImpl implements IdentityService {

    private static final Logger log = LoggerFactory.getLogger(IdentityServiceImpl.class);

    private final PersonRepository personRepository;
    private final ProfileClient profileClient;
    private final Clock clock;

    public IdentityServiceImpl(PersonRepository personRepository, ProfileClient profileClient, Clock clock) {
        this.personRepository = personRepository;
        this.profileClient = profileClient;
        this.clock = clock;
    }

    @Override
    public PersonDTO registerPerson(Long externalUserId, String displayName) {
        if (externalUserId == null) {
            throw TrackerException.invalidArgument("External user id is required");
        }
        Optional<Person> existing = personRepository.findByExternalUserId(externalUserId);
        if (existing.isPresent()) {
            return toDTO(existing.get());
        }
        Person person = new Person();
        person.setExternalUserId(externalUserId);
        person.setDisplayName(displayName != null && !displayName.isBlank() ? displayName : String.valueOf(externalUserId));
        person.setCreatedAt(LocalDateTime.now(clock));
        Person saved = personRepository.save(person);
        log.info("Registered person {} for external user {}", saved.getPersonId(), externalUserId);
        return toDTO(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public PersonDTO getPerson(Long personId) {
        return toDTO(loadPerson(personId));
    }

    @Override
    @Transactional(readOnly = true)
    public PersonDTO findByExternalUserId(Long externalUserId) {
        return personRepository.findByExternalUserId(externalUserId)
                .map(this::toDTO)
                .orElseThrow(() -> TrackerException.notFound("External user " + externalUserId));
    }

    @Override
    public PersonDTO linkProfile(Long personId, String externalHandle) {
        if (externalHandle == null || externalHandle.isBlank()) {
            throw TrackerException.invalidArgument("Handle must not be blank");
        }
        String handle = externalHandle.trim();
        Person person = loadPerson(personId);

        if (handle.equalsIgnoreCase(person.getExternalHandle())) {
            throw TrackerException.alreadyLinked(handle);
        }
        Optional<Person> owner = personRepository.findByExternalHandleIgnoreCase(handle);
        if (owner.isPresent() && !owner.get().getPersonId().equals(personId)) {
            log.warn("Person {} tried to link handle {} owned by person {}", personId, handle, owner.get().getPersonId());
            throw TrackerException.alreadyLinked(handle);
        }

        // 只调用一次外部服务，失败原样抛出
        ExternalProfile profile = profileClient.fetchProfile(handle)
                .orElseThrow(() -> TrackerException.handleNotFound(handle));

        String previous = person.getExternalHandle();
        person.setExternalHandle(profile.getHandle() != null ? profile.getHandle() : handle);
        person.setExternalProfileId(profile.getProfileId());
        person.setLinkedAt(LocalDateTime.now(clock));
        Person saved = personRepository.save(person);
        if (previous != null) {
            log.info("Person {} re-linked from {} to {}; existing progress kept", personId, previous, saved.getExternalHandle());
        } else {
            log.info("Person {} linked to {}", personId, saved.getExternalHandle());
        }
        return toDTO(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public ProfileDTO getProfile(Long personId) {
        Person person = loadPerson(personId);
        if (person.getExternalHandle() == null) {
            throw TrackerException.notLinked(personId);
        }
        return new ProfileDTO(person.getPersonId(), person.getExternalHandle(), person.getExternalProfileId(), person.getLinkedAt());
    }

    @Override
    public void unlinkProfile(Long personId) {
        Person person = loadPerson(personId);
        if (person.getExternalHandle() == null) {
            throw TrackerException.notLinked(personId);
        }
        log.info("Person {} unlinked from {}", personId, person.getExternalHandle());
        person.setExternalHandle(null);
        person.setExternalProfileId(null);
        person.setLinkedAt(null);
        personRepository.save(person);
    }

    private Person loadPerson(Long personId) {
        if (personId == null) {
            throw TrackerException.invalidArgument("Person id is required");
        }
        return personRepository.findById(personId)
                .orElseThrow(() -> TrackerException.notFound("Person " + personId));
    }

    private PersonDTO toDTO(Person person) {
        PersonDTO dto = new PersonDTO();
        dto.setPersonId(person.getPersonId());
        dto.setExternalUserId(person.getExternalUserId());
        dto.setDisplayName(person.getDisplayName());
        dto.setExternalHandle(person.getExternalHandle());
        dto.setLinkedAt(person.getLinkedAt());
        return dto;
    }
}
