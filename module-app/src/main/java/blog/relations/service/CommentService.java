package blog.relations.service;

import blog.relations.domain.Comment;
import blog.relations.domain.Post;
import blog.relations.domain.User;
import blog.relations.dto.comment.CommentResponse;
import blog.relations.error.exception.CommentNotFoundException;
import blog.relations.error.exception.PostNotFoundException;
import blog.relations.error.exception.UserNotFoundException;
import blog.relations.infrastructure.persistence.repository.CommentRepository;
import blog.relations.infrastructure.persistence.repository.PostRepository;
import blog.relations.infrastructure.persistence.repository.UserRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** 댓글 서비스. 목록은 모두 최신순입니다. */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CommentService {

  private final CommentRepository commentRepository;
  private final PostRepository postRepository;
  private final UserRepository userRepository;

  @Transactional
  public CommentResponse create(String content, Long postId, Long authorId) {
    Post post =
        postRepository.findById(postId).orElseThrow(() -> new PostNotFoundException(postId));
    User author =
        userRepository.findById(authorId).orElseThrow(() -> new UserNotFoundException(authorId));
    Comment comment = commentRepository.save(new Comment(post, author, content));
    log.info("[CommentService] 댓글 생성: id={}, postId={}", comment.getId(), postId);
    return CommentResponse.withAuthorAndPost(comment);
  }

  public List<CommentResponse> findAll(Long postId, Long authorId) {
    return commentRepository.search(postId, authorId).stream()
        .map(CommentResponse::withAuthorAndPost)
        .toList();
  }

  public CommentResponse findOne(Long id) {
    Comment comment =
        commentRepository.findDetailById(id).orElseThrow(() -> new CommentNotFoundException(id));
    return CommentResponse.detail(comment);
  }

  @Transactional
  public CommentResponse update(Long id, String content) {
    Comment comment = getComment(id);
    comment.updateContent(content);
    commentRepository.flush();
    log.info("[CommentService] 댓글 수정: id={}", id);
    return CommentResponse.withAuthorAndPost(comment);
  }

  @Transactional
  public CommentResponse remove(Long id) {
    Comment comment = getComment(id);
    CommentResponse removed = CommentResponse.from(comment);
    commentRepository.delete(comment);
    log.info("[CommentService] 댓글 삭제: id={}", id);
    return removed;
  }

  /** 게시글의 댓글 (작성자 프로필 포함) */
  public List<CommentResponse> findByPost(Long postId) {
    return commentRepository.findByPostIdOrderByCreatedAtDescIdDesc(postId).stream()
        .map(CommentResponse::withAuthorProfile)
        .toList();
  }

  /** 사용자가 작성한 댓글 (게시글과 게시글 작성자 포함) */
  public List<CommentResponse> findByUser(Long userId) {
    return commentRepository.findByAuthorIdOrderByCreatedAtDescIdDesc(userId).stream()
        .map(CommentResponse::withPost)
        .toList();
  }

  private Comment getComment(Long id) {
    return commentRepository.findById(id).orElseThrow(() -> new CommentNotFoundException(id));
  }
}
