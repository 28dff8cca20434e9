package com.project.image.editor;

import com.project.image.editor.DTOs.ChromaKeyConfig;
import com.project.image.editor.DTOs.HistoryView;
import com.project.image.editor.DTOs.Snapshot;
import com.project.image.editor.exceptions.DecodeException;
import com.project.image.editor.exceptions.ExternalEditException;
import com.project.image.editor.exceptions.InvalidStateException;
import com.project.image.editor.service.AlphaCompositor;
import com.project.image.editor.service.EditKind;
import com.project.image.editor.service.EditSession;
import com.project.image.editor.service.ImageCodec;
import com.project.image.editor.service.ImageEditModel;
import com.project.image.editor.service.ImageEditingService;
import com.project.image.editor.service.UploadService;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;

import static org.assertj.core.api.Assertions.*;

class ImageEditingServiceTest {
    private final AlphaCompositor compositor = new AlphaCompositor(new ImageCodec(), 262_144);
    private final List<String> instructions = new ArrayList<>();

    private ImageEditingService serviceReturning(Snapshot result) {
        ImageEditModel model = (image, instruction) -> {
            instructions.add(instruction);
            return result;
        };
        return new ImageEditingService(model, compositor, new UploadService(), ChromaKeyConfig.MAGENTA);
    }

    private ImageEditingService serviceFailing(RuntimeException failure) {
        ImageEditModel model = (image, instruction) -> { throw failure; };
        return new ImageEditingService(model, compositor, new UploadService(), ChromaKeyConfig.MAGENTA);
    }

    @Test
    void load_turnsUploadIntoFirstSnapshot() {
        EditSession session = new EditSession();
        MockMultipartFile file = new MockMultipartFile("file", "a.png", "image/png", new byte[]{1, 2, 3});

        serviceReturning(TestImages.fake("x")).load(session, file);

        assertThat(session.current()).contains(new Snapshot(new byte[]{1, 2, 3}, "image/png"));
        assertThat(session.view().currentIndex()).isZero();
    }

    @Test
    void backgroundRemoval_runsChromaKey() throws Exception {
        EditSession session = new EditSession();
        session.load(TestImages.fake("original"));
        Snapshot modelOutput = TestImages.jpeg(TestImages.subjectOnMagenta());

        Snapshot result = serviceReturning(modelOutput).applyEdit(session, EditKind.REMOVE_BACKGROUND);

        assertThat(instructions).containsExactly(EditKind.REMOVE_BACKGROUND.instruction());
        assertThat(result.mimeType()).isEqualTo("image/png");
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(result.data()));
        assertThat(decoded.getRGB(1, 1) >>> 24).isZero();
        assertThat(session.current()).contains(result);
        assertThat(session.view().size()).isEqualTo(2);
    }

    @Test
    void blemishRemoval_passesModelOutputThrough() {
        EditSession session = new EditSession();
        session.load(TestImages.fake("original"));
        Snapshot modelOutput = TestImages.fake("cleaned");

        Snapshot result = serviceReturning(modelOutput).applyEdit(session, EditKind.REMOVE_BLEMISHES);

        assertThat(result).isSameAs(modelOutput);
        assertThat(session.current()).contains(modelOutput);
        assertThat(instructions).containsExactly(EditKind.REMOVE_BLEMISHES.instruction());
    }

    @Test
    void edit_usesSnapshotUnderCursor_andTruncatesFuture() {
        EditSession session = new EditSession();
        Snapshot a = TestImages.fake("A");
        session.load(a);
        List<Snapshot> bases = new ArrayList<>();
        ImageEditModel model = (image, instruction) -> {
            bases.add(image);
            return TestImages.fake("edit-" + bases.size());
        };
        ImageEditingService service = new ImageEditingService(model, compositor, new UploadService(), ChromaKeyConfig.MAGENTA);

        service.applyEdit(session, EditKind.REMOVE_BLEMISHES);
        service.applyEdit(session, EditKind.REMOVE_BLEMISHES);
        session.undo();
        session.undo();
        service.applyEdit(session, EditKind.REMOVE_BLEMISHES);

        assertThat(bases.get(2)).isEqualTo(a);
        assertThat(session.view().size()).isEqualTo(2);
        assertThat(session.current()).contains(TestImages.fake("edit-3"));
    }

    @Test
    void modelFailure_leavesHistoryUntouched() {
        EditSession session = new EditSession();
        session.load(TestImages.fake("A"));
        serviceReturning(TestImages.fake("B")).applyEdit(session, EditKind.REMOVE_BLEMISHES);
        session.undo();
        HistoryView before = session.view();

        ImageEditingService failing = serviceFailing(new ExternalEditException("timeout"));
        assertThatThrownBy(() -> failing.applyEdit(session, EditKind.REMOVE_BACKGROUND))
                .isInstanceOf(ExternalEditException.class);

        assertThat(session.view()).isEqualTo(before);
        assertThat(session.current()).contains(TestImages.fake("A"));
        assertThat(session.redo()).isTrue();
    }

    @Test
    void undecodableModelOutput_leavesHistoryUntouched() {
        EditSession session = new EditSession();
        session.load(TestImages.fake("A"));
        HistoryView before = session.view();

        ImageEditingService service = serviceReturning(TestImages.fake("not really a png"));
        assertThatThrownBy(() -> service.applyEdit(session, EditKind.REMOVE_BACKGROUND))
                .isInstanceOf(DecodeException.class);

        assertThat(session.view()).isEqualTo(before);
        assertThat(session.isEditPending()).isFalse();
    }

    @Test
    void unexpectedFailure_alsoReleasesTheSession() {
        EditSession session = new EditSession();
        session.load(TestImages.fake("A"));

        assertThatThrownBy(() -> serviceFailing(new IllegalStateException("boom")).applyEdit(session, EditKind.REMOVE_BLEMISHES))
                .isInstanceOf(IllegalStateException.class);
        assertThat(session.isEditPending()).isFalse();
        assertThat(session.view().size()).isEqualTo(1);
    }

    @Test
    void errorFromModel_releasesTheSession() {
        EditSession session = new EditSession();
        session.load(TestImages.fake("A"));
        HistoryView before = session.view();
        ImageEditModel model = (image, instruction) -> { throw new OutOfMemoryError("decoder ran out of heap"); };
        ImageEditingService service = new ImageEditingService(model, compositor, new UploadService(), ChromaKeyConfig.MAGENTA);

        assertThatThrownBy(() -> service.applyEdit(session, EditKind.REMOVE_BACKGROUND))
                .isInstanceOf(OutOfMemoryError.class);

        assertThat(session.isEditPending()).isFalse();
        assertThat(session.view()).isEqualTo(before);
        session.reset();
        session.load(TestImages.fake("B"));
        assertThat(serviceReturning(TestImages.fake("C")).applyEdit(session, EditKind.REMOVE_BLEMISHES))
                .isEqualTo(TestImages.fake("C"));
    }

    @Test
    void edit_withoutImage_isInvalidState() {
        EditSession session = new EditSession();
        assertThatThrownBy(() -> serviceReturning(TestImages.fake("B")).applyEdit(session, EditKind.REMOVE_BLEMISHES))
                .isInstanceOf(InvalidStateException.class);
        assertThat(instructions).isEmpty();
    }
}
