package com.faceattendance.service;

import com.faceattendance.exception.AttendanceException;
import com.faceattendance.gallery.EmbeddingCodec;
import com.faceattendance.gallery.EmbeddingGallery;
import com.faceattendance.gallery.Embeddings;
import com.faceattendance.gallery.Identity;
import com.faceattendance.model.User;
import com.faceattendance.provider.DetectedFace;
import com.faceattendance.provider.EmbeddingProvider;
import com.faceattendance.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Registers and removes people. The database row is written first and the
 * gallery is updated only once the row is stored.
 */
@Service
public class RegistrationService {
    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    private final UserRepository userRepository;
    private final EmbeddingProvider embeddingProvider;
    private final EmbeddingGallery gallery;
    private final EmbeddingCodec codec;
    private final Clock clock;

    public RegistrationService(UserRepository userRepository,
                               EmbeddingProvider embeddingProvider,
                               EmbeddingGallery gallery,
                               EmbeddingCodec codec,
                               Clock clock) {
        this.userRepository = userRepository;
        this.embeddingProvider = embeddingProvider;
        this.gallery = gallery;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * @throws AttendanceException {@code INVALID_IDENTITY} for missing fields or a
     *                             duplicate user id, {@code NO_FACE_DETECTED},
     *                             {@code DECODE_ERROR}, provider errors
     */
    public User register(String userId, String name, byte[] image) {
        if (userId == null || userId.isBlank()) {
            throw AttendanceException.invalidIdentity("User ID is required");
        }
        if (name == null || name.isBlank()) {
            throw AttendanceException.invalidIdentity("Name is required");
        }
        String id = userId.trim();
        if (userRepository.existsByUserId(id)) {
            throw AttendanceException.invalidIdentity("User ID already registered");
        }

        ImagePayloads.requireImage(image);
        List<DetectedFace> faces = embeddingProvider.extract(image);
        if (faces.isEmpty()) {
            throw AttendanceException.noFaceDetected();
        }
        if (faces.size() > 1) {
            log.warn("Registration image for {} has {} faces, using the first one", id, faces.size());
        }
        float[] embedding = faces.get(0).getEmbedding();
        Embeddings.validate(embedding, gallery.dimension());

        User user = new User();
        user.setUserId(id);
        user.setName(name.trim());
        user.setEmbedding(codec.encode(embedding));
        user.setCreatedAt(clock.instant());
        User saved = userRepository.save(user);

        gallery.upsert(toIdentity(saved, embedding));
        log.info("User registered successfully: {} ({})", saved.getUserId(), saved.getName());
        return saved;
    }

    public List<User> listUsers() {
        return userRepository.findAll();
    }

    /**
     * Deletes the user and drops them from the gallery. Their attendance
     * history is kept.
     *
     * @return false if no such user exists
     */
    public boolean deleteUser(String userId) {
        Optional<User> user = userRepository.findByUserId(userId);
        if (user.isEmpty()) {
            return false;
        }
        userRepository.delete(user.get());
        gallery.remove(userId);
        log.info("User deleted successfully: {}", userId);
        return true;
    }

    /**
     * Publishes every stored user to the gallery. Rows whose embedding cannot
     * be read are skipped.
     *
     * @return the number of identities now in the gallery
     */
    public int reloadGallery() {
        List<Identity> identities = new ArrayList<>();
        for (User user : userRepository.findAll()) {
            try {
                identities.add(toIdentity(user, codec.decode(user.getEmbedding())));
            } catch (AttendanceException e) {
                log.warn("Skipping stored user {}: {}", user.getUserId(), e.getMessage());
            }
        }
        int loaded = gallery.loadAll(identities);
        log.info("Loaded {} identities into the gallery", loaded);
        return loaded;
    }

    private static Identity toIdentity(User user, float[] embedding) {
        return new Identity(user.getUserId(), user.getName(), embedding, user.getCreatedAt());
    }
}
